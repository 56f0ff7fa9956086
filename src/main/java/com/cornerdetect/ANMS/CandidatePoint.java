package com.cornerdetect.ANMS;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * Điểm cực đại cục bộ lấy từ bản đồ phản hồi: cột u, hàng v và giá trị phản hồi.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class CandidatePoint {
    public final int u, v;
    public final double score;

    public static final Comparator<CandidatePoint> BY_SCORE_DESC =
            Comparator.comparingDouble(CandidatePoint::getScore).reversed();

    public double distanceTo(CandidatePoint that) {
        double du = this.u - that.u;
        double dv = this.v - that.v;
        return Math.sqrt(du * du + dv * dv);
    }

    @Override
    public String toString() {
        return String.format("Candidate at (%d, %d) score=%.4f", u, v, score);
    }
}
