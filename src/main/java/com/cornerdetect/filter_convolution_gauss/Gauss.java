package com.cornerdetect.filter_convolution_gauss;

import com.cornerdetect.exception.InvalidParameterException;

public class Gauss {

    /**
     * Tạo một hạt nhân Gaussian 2D kích thước n x n.
     * Ô (row, col) = exp(-((col - mean)^2 + (row - mean)^2) / (2 * sigma^2)), mean = n / 2.
     *
     * @param n     Kích thước kernel (phải là số lẻ).
     * @param sigma Độ lệch chuẩn (mức độ mờ).
     * @return Hạt nhân Gaussian 2D đã được chuẩn hóa (tổng = 1).
     */
    public static double[][] getGaussianKernel(int n, double sigma) {
        if (n < 1 || n % 2 == 0) {
            throw new InvalidParameterException("Kernel size phải là số lẻ >= 1: " + n);
        }
        if (!(sigma > 0)) {
            throw new InvalidParameterException("Sigma phải > 0: " + sigma);
        }
        int mean = n / 2;
        double[][] kernel = new double[n][n];
        double sum = 0;

        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                int dx = col - mean;
                int dy = row - mean;
                double value = Math.exp(-(dx * dx + dy * dy) / (2.0 * sigma * sigma));
                kernel[row][col] = value;
                sum += value;
            }
        }

        // Chuẩn hóa hạt nhân để tổng các phần tử bằng 1
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                kernel[row][col] /= sum;
            }
        }
        return kernel;
    }

    /**
     * Kernel Gaussian với kích thước tự chọn theo quy tắc 3-sigma:
     * số lẻ nhỏ nhất >= 5 * sigma (sigma = 2 -> 11 x 11).
     */
    public static double[][] gaussian(double sigma) {
        return getGaussianKernel(kernelSize(sigma), sigma);
    }

    public static int kernelSize(double sigma) {
        if (!(sigma > 0)) {
            throw new InvalidParameterException("Sigma phải > 0: " + sigma);
        }
        int n = (int) Math.ceil(5 * sigma);
        if (n % 2 == 0) n++;
        return n;
    }
}
