package com.cornerdetect.filter_convolution_gauss;

import com.cornerdetect.exception.InvalidParameterException;
import com.cornerdetect.imageOperator.Matrix_Image;

import java.util.Arrays;

public class LinearFiltering {

    public static double[][] convolve2D(double[][] image, double[][] kernel, String boundaryMode) {
        return convolve2D(image, kernel, BoundaryMode.fromString(boundaryMode), 0);
    }

    public static double[][] convolve2D(double[][] image, double[][] kernel, String boundaryMode, double fill) {
        return convolve2D(image, kernel, BoundaryMode.fromString(boundaryMode), fill);
    }

    public static double[][] convolve2D(double[][] image, double[][] kernel, BoundaryMode boundaryMode) {
        return convolve2D(image, kernel, boundaryMode, 0);
    }

    /**
     * Tích chập 2D thật sự (kernel được xoay 180 độ trước khi nhân) với chế độ xử lý biên.
     *
     * @param image        Ảnh đầu vào [height][width].
     * @param kernel       Kernel vuông, cạnh lẻ.
     * @param boundaryMode Cách xử lý biên.
     * @param fill         Giá trị đệm, chỉ dùng cho FILL.
     * @return Ảnh mới cùng kích thước với ảnh đầu vào.
     */
    public static double[][] convolve2D(double[][] image, double[][] kernel, BoundaryMode boundaryMode, double fill) {
        Matrix_Image.checkImage(image);
        checkKernel(kernel);
        if (boundaryMode == null) {
            throw new InvalidParameterException("invalid boundary mode: null");
        }
        int r = kernel.length / 2;

        if (boundaryMode == BoundaryMode.VALID) {
            return convolveInterior(image, kernel);
        }

        double[][] convInput = pad(image, r, boundaryMode, fill);
        double[][] convOut = convolveInterior(convInput, kernel);
        return Matrix_Image.crop(convOut, r);
    }

    /**
     * Đệm ảnh thêm r pixel ở mỗi cạnh theo chế độ biên, kết quả có kích thước (M + 2r) x (N + 2r).
     */
    public static double[][] pad(double[][] image, int r, BoundaryMode boundaryMode, double fill) {
        Matrix_Image.checkImage(image);
        if (r < 0) throw new InvalidParameterException("Bán kính phải >= 0: " + r);
        if (boundaryMode == null || boundaryMode == BoundaryMode.VALID) {
            throw new InvalidParameterException("Chế độ " + boundaryMode + " không đệm ảnh");
        }
        int height = image.length;
        int width = image[0].length;
        double[][] padded = new double[height + 2 * r][width + 2 * r];

        if (boundaryMode == BoundaryMode.FILL) {
            for (int y = 0; y < padded.length; y++) {
                if (y < r || y >= height + r) {
                    Arrays.fill(padded[y], fill);
                    continue;
                }
                Arrays.fill(padded[y], 0, r, fill);
                System.arraycopy(image[y - r], 0, padded[y], r, width);
                Arrays.fill(padded[y], width + r, width + 2 * r, fill);
            }
            return padded;
        }

        // Mỗi trục ánh xạ độc lập nên 4 khối góc tự đúng (vd WRAP: góc trên-trái lấy góc dưới-phải)
        int[] srcX = new int[width + 2 * r];
        for (int x = 0; x < srcX.length; x++) srcX[x] = boundaryMode.sourceIndex(x - r, width);
        for (int y = 0; y < padded.length; y++) {
            double[] srcRow = image[boundaryMode.sourceIndex(y - r, height)];
            for (int x = 0; x < srcX.length; x++) {
                padded[y][x] = srcRow[srcX[x]];
            }
        }
        return padded;
    }

    /**
     * Vòng lặp chính: chỉ tính các pixel mà kernel nằm trọn trong ảnh, phần biên rộng r = 0.
     */
    private static double[][] convolveInterior(double[][] g, double[][] h) {
        int height = g.length;
        int width = g[0].length;
        int n = h.length;
        int radius = n / 2;
        double[][] out = new double[height][width];

        // Xoay kernel 180 độ một lần
        double[][] h180 = new double[n][n];
        for (int ky = 0; ky < n; ky++)
            for (int kx = 0; kx < n; kx++)
                h180[ky][kx] = h[n - 1 - ky][n - 1 - kx];

        for (int v = radius; v < height - radius; v++) {
            for (int u = radius; u < width - radius; u++) {
                double sum = 0;
                for (int ky = 0; ky < n; ky++) {
                    double[] gRow = g[v - radius + ky];
                    double[] hRow = h180[ky];
                    for (int kx = 0; kx < n; kx++) {
                        sum += gRow[u - radius + kx] * hRow[kx];
                    }
                }
                out[v][u] = sum;
            }
        }
        return out;
    }

    static void checkKernel(double[][] kernel) {
        if (kernel == null || kernel.length == 0) {
            throw new InvalidParameterException("Kernel rỗng");
        }
        int n = kernel.length;
        if (n % 2 == 0) {
            throw new InvalidParameterException("Kernel size phải là số lẻ: " + n);
        }
        for (double[] row : kernel) {
            if (row == null || row.length != n) {
                throw new InvalidParameterException("Kernel phải là ma trận vuông " + n + "x" + n);
            }
        }
    }
}
