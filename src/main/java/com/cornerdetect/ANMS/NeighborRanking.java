package com.cornerdetect.ANMS;

import java.util.List;

/**
 * Tính bán kính triệt tiêu cho từng ứng viên.
 */
public interface NeighborRanking {

    /**
     * @param maxima Các cực đại cục bộ theo thứ tự quét.
     * @param c      Tỉ lệ triệt tiêu: k mạnh hơn đáng kể i khi h_i < c * h_k.
     * @param rmax   Bán kính gán cho điểm không có lân cận mạnh hơn (max(rows, cols)^2).
     * @return Các điểm đã có bán kính, chưa sắp xếp.
     */
    List<RankedPoint> rank(List<CandidatePoint> maxima, double c, double rmax);
}
