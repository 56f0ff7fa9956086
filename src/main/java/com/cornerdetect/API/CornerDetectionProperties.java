package com.cornerdetect.API;

import com.cornerdetect.ANMS.AnmsConfig;
import com.cornerdetect.ANMS.AnmsVariant;
import com.cornerdetect.ANMS.UnresolvedPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cấu hình mặc định của pipeline, đọc từ application.properties (prefix "corner").
 * Mỗi request có thể ghi đè từng giá trị.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "corner")
public class CornerDetectionProperties {

    // valid | fill | extend | mirror | wrap
    private String boundaryMode = "valid";
    private double fillValue = 0;
    private Anms anms = new Anms();

    @Getter
    @Setter
    public static class Anms {
        private AnmsVariant variant = AnmsVariant.BRUTE_FORCE;
        private int n = AnmsConfig.DEFAULT_N;
        private double c = AnmsConfig.DEFAULT_C;
        private int edge = 0;
        private boolean useThreshold = AnmsConfig.DEFAULT_USE_THRESHOLD;
        private UnresolvedPolicy unresolvedPolicy = UnresolvedPolicy.OMIT;
    }
}
