package com.cornerdetect.ANMS;

import java.util.ArrayList;
import java.util.List;

/**
 * So sánh từng cặp ứng viên, O(k^2).
 */
public class BruteForceRanking implements NeighborRanking {

    @Override
    public List<RankedPoint> rank(List<CandidatePoint> maxima, double c, double rmax) {
        List<RankedPoint> ranked = new ArrayList<>(maxima.size());
        for (int i = 0; i < maxima.size(); i++) {
            CandidatePoint p = maxima.get(i);
            double rmin = rmax;
            for (int k = 0; k < maxima.size(); k++) {
                if (i == k) continue;
                CandidatePoint q = maxima.get(k);
                if (p.score < c * q.score) {
                    double d = p.distanceTo(q);
                    if (d < rmin) rmin = d;
                }
            }
            ranked.add(new RankedPoint(p, rmin));
        }
        return ranked;
    }
}
