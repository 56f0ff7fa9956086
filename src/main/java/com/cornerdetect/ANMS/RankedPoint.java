package com.cornerdetect.ANMS;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * Điểm ứng viên kèm bán kính triệt tiêu: khoảng cách tới lân cận "mạnh hơn đáng kể" gần nhất.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class RankedPoint {
    private final int u;
    private final int v;
    private final double score;
    private final double radius;

    public static final Comparator<RankedPoint> BY_RADIUS_DESC =
            Comparator.comparingDouble(RankedPoint::getRadius).reversed();

    public RankedPoint(CandidatePoint candidate, double radius) {
        this(candidate.u, candidate.v, candidate.score, radius);
    }

    /** Dịch tọa độ khi bản đồ đã bị cắt biên. */
    public RankedPoint shifted(int offset) {
        if (offset == 0) return this;
        return new RankedPoint(u + offset, v + offset, score, radius);
    }

    @Override
    public String toString() {
        return String.format("Corner at (%d, %d) score=%.4f radius=%.2f", u, v, score, radius);
    }
}
