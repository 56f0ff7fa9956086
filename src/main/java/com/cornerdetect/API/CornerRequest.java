package com.cornerdetect.API;

import com.cornerdetect.ANMS.AnmsVariant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body JSON của POST /api/corners. Trường nào null thì dùng giá trị trong cấu hình.
 */
@Getter
@Setter
@NoArgsConstructor
public class CornerRequest {
    private double[][] image;
    private Integer n;
    private Double c;
    private Integer edge;
    private Boolean useThreshold;
    private AnmsVariant variant;
    private String boundaryMode;
    private Double fillValue;
    private boolean zipped;          // true: trả về "points": [[u, v], ...]
    private boolean includeResponse; // true: trả kèm bản đồ phản hồi Harris
}
