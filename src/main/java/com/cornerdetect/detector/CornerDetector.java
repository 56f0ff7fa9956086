package com.cornerdetect.detector;

import com.cornerdetect.ANMS.AnmsConfig;
import com.cornerdetect.ANMS.AnmsResult;
import com.cornerdetect.ANMS.AnmsSelector;
import com.cornerdetect.ANMS.AnmsVariant;
import com.cornerdetect.ANMS.UnresolvedPolicy;
import com.cornerdetect.filter_convolution_gauss.BoundaryMode;
import com.cornerdetect.harris.HarrisResponse;
import com.cornerdetect.imageOperator.Matrix_Image;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline: ảnh xám -> Harris -> cực đại cục bộ -> ANMS.
 */
@Slf4j
@Getter
public class CornerDetector {

    private final BoundaryMode convMode;
    private final double fillValue;
    private final AnmsSelector selector;
    private final int n;
    private final double c;
    private final int edge;
    private final boolean useThreshold;

    public CornerDetector(BoundaryMode convMode, double fillValue, AnmsSelector selector,
                          int n, double c, int edge, boolean useThreshold) {
        this.convMode = convMode;
        this.fillValue = fillValue;
        this.selector = selector;
        this.n = n;
        this.c = c;
        this.edge = edge;
        this.useThreshold = useThreshold;
    }

    /** Harris VALID + ANMS brute force, không cắt biên. */
    public static CornerDetector bruteForce(int n) {
        return new CornerDetector(BoundaryMode.VALID, 0,
                AnmsSelector.forVariant(AnmsVariant.BRUTE_FORCE, null),
                n, AnmsConfig.DEFAULT_C, 0, AnmsConfig.DEFAULT_USE_THRESHOLD);
    }

    /** Harris VALID + ANMS kd-tree, cắt biên mặc định. */
    public static CornerDetector kdTree(int n) {
        return new CornerDetector(BoundaryMode.VALID, 0,
                AnmsSelector.forVariant(AnmsVariant.KD_TREE, UnresolvedPolicy.OMIT),
                n, AnmsConfig.DEFAULT_C, AnmsConfig.DEFAULT_EDGE, AnmsConfig.DEFAULT_USE_THRESHOLD);
    }

    public CornerDetectionResult detect(double[][] image) {
        Matrix_Image.checkImage(image);
        long start = System.currentTimeMillis();
        double[][] response = HarrisResponse.harrisResponse(image, convMode, fillValue);
        AnmsResult corners = selector.select(response, n, c, edge, useThreshold);
        log.debug("Phát hiện {} góc trên ảnh {}x{} trong {} ms",
                corners.size(), image.length, image[0].length, System.currentTimeMillis() - start);
        return new CornerDetectionResult(response, corners);
    }
}
