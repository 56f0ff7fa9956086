package com.cornerdetect.imageOperator;

import com.cornerdetect.exception.InvalidParameterException;

public class Matrix_Image {
    // Luôn là format [height][width]

    /**
     * Kiểm tra ma trận ảnh: khác rỗng và là hình chữ nhật (mọi hàng cùng độ dài).
     */
    public static void checkImage(double[][] img) {
        if (img == null || img.length == 0 || img[0] == null || img[0].length == 0) {
            throw new InvalidParameterException("Ảnh rỗng");
        }
        int width = img[0].length;
        for (int y = 1; y < img.length; y++) {
            if (img[y] == null || img[y].length != width) {
                throw new InvalidParameterException("Ảnh không phải hình chữ nhật tại hàng " + y);
            }
        }
    }

    public static double[][] transpose(double[][] img) {
        double[][] out = new double[img[0].length][img.length];
        for (int y = 0; y < img.length; y++)
            for (int x = 0; x < img[0].length; x++)
                out[x][y] = img[y][x];
        return out;
    }

    /** Nhân từng phần tử a * b (hai ảnh cùng kích thước). */
    public static double[][] multiply(double[][] a, double[][] b) {
        int height = a.length;
        int width = a[0].length;
        if (b.length != height || b[0].length != width) {
            throw new InvalidParameterException("Hai ảnh khác kích thước");
        }
        double[][] out = new double[height][width];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                out[y][x] = a[y][x] * b[y][x];
        return out;
    }

    public static double mean(double[][] img) {
        double sum = 0;
        for (double[] row : img)
            for (double p : row) sum += p;
        return sum / ((double) img.length * img[0].length);
    }

    /** Độ lệch chuẩn tổng thể (chia cho N, không phải N-1). */
    public static double std(double[][] img) {
        double mean = mean(img);
        double sum = 0;
        for (double[] row : img)
            for (double p : row) sum += (p - mean) * (p - mean);
        return Math.sqrt(sum / ((double) img.length * img[0].length));
    }

    public static double min(double[][] img) {
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : img)
            for (double p : row) min = Math.min(min, p);
        return min;
    }

    /**
     * Cắt bỏ một dải rộng {@code edge} pixel ở cả 4 cạnh.
     * Trả về mảng rỗng (0 hàng) nếu không còn phần bên trong.
     */
    public static double[][] crop(double[][] img, int edge) {
        if (edge < 0) throw new InvalidParameterException("edge phải >= 0: " + edge);
        // so sánh bằng long để 2 * edge không tràn số với edge rất lớn
        long height = img.length - 2L * edge;
        long width = img[0].length - 2L * edge;
        if (height <= 0 || width <= 0) return new double[0][0];
        return cropInterior(img, edge, (int) height, (int) width);
    }

    private static double[][] cropInterior(double[][] img, int edge, int height, int width) {
        double[][] out = new double[height][width];
        for (int y = 0; y < height; y++)
            System.arraycopy(img[y + edge], edge, out[y], 0, width);
        return out;
    }
}
