package com.cornerdetect.ANMS;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Các góc được chọn, theo thứ tự bán kính triệt tiêu giảm dần.
 */
@Getter
public class AnmsResult {
    private final List<RankedPoint> points;

    public AnmsResult(List<RankedPoint> points) {
        this.points = Collections.unmodifiableList(points);
    }

    public static AnmsResult empty() {
        return new AnmsResult(Collections.emptyList());
    }

    public int size() {
        return points.size();
    }

    /** Tọa độ cột (x). */
    public int[] getU() {
        return points.stream().mapToInt(RankedPoint::getU).toArray();
    }

    /** Tọa độ hàng (y). */
    public int[] getV() {
        return points.stream().mapToInt(RankedPoint::getV).toArray();
    }

    /** Dạng cặp [[u, v], ...]. */
    public int[][] getZipped() {
        int[][] zipped = new int[points.size()][];
        for (int i = 0; i < zipped.length; i++) {
            zipped[i] = new int[]{points.get(i).getU(), points.get(i).getV()};
        }
        return zipped;
    }
}
