package com.cornerdetect.ANMS;

import com.cornerdetect.imageOperator.Matrix_Image;

import java.util.ArrayList;
import java.util.List;

public class LocalMaxima {

    public static List<CandidatePoint> getMaxima(double[][] im, double threshold) {
        return getMaxima(im, threshold, false);
    }

    /**
     * Tìm các cực đại cục bộ chặt trong lân cận 8 điểm.
     * Bỏ qua đường viền 1 pixel. Hai điểm kề nhau có giá trị bằng nhau thì không điểm nào được chọn.
     *
     * @param im        Bản đồ phản hồi [height][width].
     * @param threshold Chỉ xét các điểm có giá trị >= threshold.
     * @param sort      true: sắp xếp giảm dần theo giá trị, false: giữ thứ tự quét theo hàng.
     */
    public static List<CandidatePoint> getMaxima(double[][] im, double threshold, boolean sort) {
        Matrix_Image.checkImage(im);
        List<CandidatePoint> points = new ArrayList<>();
        int m = im.length;
        int n = im[0].length;

        for (int k = 1; k < m - 1; k++) {
            for (int j = 1; j < n - 1; j++) {
                double p = im[k][j];
                if (p < threshold) continue;
                if (isStrictMaximum(im, k, j, p)) {
                    points.add(new CandidatePoint(j, k, p));
                }
            }
        }
        if (sort) points.sort(CandidatePoint.BY_SCORE_DESC);
        return points;
    }

    private static boolean isStrictMaximum(double[][] im, int k, int j, double p) {
        // 3 điểm phía trên và 3 điểm phía dưới
        for (int dj = -1; dj <= 1; dj++) {
            if (!(p > im[k - 1][j + dj])) return false;
            if (!(p > im[k + 1][j + dj])) return false;
        }
        // Trái và phải
        return p > im[k][j - 1] && p > im[k][j + 1];
    }
}
