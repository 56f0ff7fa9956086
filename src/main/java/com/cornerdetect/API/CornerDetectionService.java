package com.cornerdetect.API;

import com.cornerdetect.ANMS.AnmsSelector;
import com.cornerdetect.ANMS.AnmsVariant;
import com.cornerdetect.detector.CornerDetectionResult;
import com.cornerdetect.detector.CornerDetector;
import com.cornerdetect.exception.InvalidParameterException;
import com.cornerdetect.filter_convolution_gauss.BoundaryMode;
import com.cornerdetect.harris.HarrisResponse;
import com.cornerdetect.imageOperator.Matrix_Image;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class CornerDetectionService {

    @Autowired
    private CornerDetectionProperties properties;

    /**
     * Chạy pipeline Harris + ANMS, tham số request ghi đè cấu hình mặc định.
     */
    public CornerDetectionResult detect(CornerRequest request) {
        double[][] image = requireImage(request.getImage());
        CornerDetectionProperties.Anms anms = properties.getAnms();

        AnmsVariant variant = request.getVariant() != null ? request.getVariant() : anms.getVariant();
        CornerDetector detector = new CornerDetector(
                boundaryMode(request.getBoundaryMode()),
                request.getFillValue() != null ? request.getFillValue() : properties.getFillValue(),
                AnmsSelector.forVariant(variant, anms.getUnresolvedPolicy()),
                request.getN() != null ? request.getN() : anms.getN(),
                request.getC() != null ? request.getC() : anms.getC(),
                request.getEdge() != null ? request.getEdge() : anms.getEdge(),
                request.getUseThreshold() != null ? request.getUseThreshold() : anms.isUseThreshold());

        log.info("Corner detection {}x{} variant={} n={} c={} edge={} mode={}",
                image.length, image[0].length, variant, detector.getN(), detector.getC(),
                detector.getEdge(), detector.getConvMode().key());
        CornerDetectionResult result = detector.detect(image);
        log.info("=== Chọn được {} góc ===", result.getCorners().size());
        return result;
    }

    public double[][] harris(HarrisRequest request) {
        double[][] image = requireImage(request.getImage());
        double fill = request.getFillValue() != null ? request.getFillValue() : properties.getFillValue();
        return HarrisResponse.harrisResponse(image, boundaryMode(request.getBoundaryMode()), fill);
    }

    private BoundaryMode boundaryMode(String requested) {
        return BoundaryMode.fromString(requested != null ? requested : properties.getBoundaryMode());
    }

    private static double[][] requireImage(double[][] image) {
        if (image == null) {
            throw new InvalidParameterException("Vui lòng gửi ảnh (mảng 2 chiều).");
        }
        Matrix_Image.checkImage(image);
        return image;
    }
}
