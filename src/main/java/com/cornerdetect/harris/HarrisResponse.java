package com.cornerdetect.harris;

import com.cornerdetect.filter_convolution_gauss.BoundaryMode;
import com.cornerdetect.filter_convolution_gauss.Gauss;
import com.cornerdetect.filter_convolution_gauss.LinearFiltering;
import com.cornerdetect.imageOperator.Matrix_Image;
import lombok.extern.slf4j.Slf4j;

/**
 * Tính bản đồ phản hồi Harris (cornerness) cho ảnh xám.
 * <p>
 * H = det(M) / (trace(M) + epsilon), với M là ma trận moment bậc hai
 * đã được làm mịn bằng cửa sổ Gaussian sigma = 2.
 */
@Slf4j
public class HarrisResponse {

    public static final double WINDOW_SIGMA = 2.0;
    public static final double EPSILON = 1e-10;

    // Sobel theo hướng u (ngang), Sv là chuyển vị; không lộ ra ngoài để không ai sửa được
    private static final double[][] SOBEL_U = {
            {-1, 0, 1},
            {-2, 0, 2},
            {-1, 0, 1}
    };
    private static final double[][] SOBEL_V = Matrix_Image.transpose(SOBEL_U);

    /** Bản sao của kernel Sobel theo u. */
    public static double[][] sobelU() {
        return copyOf(SOBEL_U);
    }

    /** Bản sao của kernel Sobel theo v. */
    public static double[][] sobelV() {
        return copyOf(SOBEL_V);
    }

    private static double[][] copyOf(double[][] kernel) {
        double[][] out = new double[kernel.length][];
        for (int y = 0; y < kernel.length; y++) out[y] = kernel[y].clone();
        return out;
    }

    public static double[][] harrisResponse(double[][] img) {
        return harrisResponse(img, BoundaryMode.VALID, 0);
    }

    public static double[][] harrisResponse(double[][] img, BoundaryMode convMode) {
        return harrisResponse(img, convMode, 0);
    }

    /**
     * @param img      Ảnh xám [height][width].
     * @param convMode Chế độ biên cho cả hai lần tích chập (mặc định VALID: viền ảnh không có ý nghĩa).
     * @param fill     Giá trị đệm khi convMode = FILL.
     * @return Bản đồ phản hồi cùng kích thước ảnh, có thể âm.
     */
    public static double[][] harrisResponse(double[][] img, BoundaryMode convMode, double fill) {
        double[][] w = Gauss.gaussian(WINDOW_SIGMA);

        double[][] iu = LinearFiltering.convolve2D(img, SOBEL_U, convMode, fill);
        double[][] iv = LinearFiltering.convolve2D(img, SOBEL_V, convMode, fill);

        double[][] iuu = LinearFiltering.convolve2D(Matrix_Image.multiply(iu, iu), w, convMode, fill);
        double[][] ivv = LinearFiltering.convolve2D(Matrix_Image.multiply(iv, iv), w, convMode, fill);
        double[][] iuv = LinearFiltering.convolve2D(Matrix_Image.multiply(iu, iv), w, convMode, fill);

        int height = img.length;
        int width = img[0].length;
        double[][] h = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double det = iuu[y][x] * ivv[y][x] - iuv[y][x] * iuv[y][x];
                double trace = iuu[y][x] + ivv[y][x];
                h[y][x] = det / (trace + EPSILON);
            }
        }
        log.debug("Harris response {}x{} ({}), window {}x{}", height, width, convMode.key(), w.length, w.length);
        return h;
    }
}
