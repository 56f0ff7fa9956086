package com.cornerdetect.ANMS;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.KNearestNeighborSearchOnKDTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Tìm lân cận tăng dần trên kd-tree: bắt đầu với k = 2 (k = 1 là chính điểm đó), lấy điểm xa nhất
 * trong k điểm gần nhất làm "điểm biên"; nếu điểm biên mạnh hơn đáng kể thì bán kính = khoảng cách tới nó,
 * ngược lại tăng k. k chạy tới (số ứng viên - 1).
 * <p>
 * Các lân cận cách đều điểm biên đều được xét như điểm biên, nên kết quả không phụ thuộc thứ tự
 * mà cây trả về cho các điểm cùng khoảng cách.
 * <p>
 * Trường hợp xấu nhất O(k^2) cho mỗi điểm, nhưng thực tế thường dừng sau vài lân cận.
 */
@Slf4j
@Getter
public class KdTreeRanking implements NeighborRanking {

    private final UnresolvedPolicy unresolvedPolicy;

    public KdTreeRanking() {
        this(UnresolvedPolicy.OMIT);
    }

    public KdTreeRanking(UnresolvedPolicy unresolvedPolicy) {
        this.unresolvedPolicy = unresolvedPolicy;
    }

    @Override
    public List<RankedPoint> rank(List<CandidatePoint> maxima, double c, double rmax) {
        int nm = maxima.size();
        List<RankedPoint> ranked = new ArrayList<>(nm);
        if (nm == 0) return ranked;

        // KDTree sắp xếp lại danh sách, giá trị mang theo chỉ số ứng viên
        List<Integer> indices = new ArrayList<>(nm);
        List<RealPoint> positions = new ArrayList<>(nm);
        for (int i = 0; i < nm; i++) {
            indices.add(i);
            positions.add(new RealPoint(maxima.get(i).u, maxima.get(i).v));
        }
        KDTree<Integer> tree = new KDTree<>(indices, positions);

        int unresolved = 0;
        for (int i = 0; i < nm; i++) {
            CandidatePoint p = maxima.get(i);
            RealPoint query = new RealPoint(p.u, p.v);
            boolean resolved = false;
            for (int k = AnmsConfig.KD_TREE_FIRST_K; k < nm; k++) {
                KNearestNeighborSearchOnKDTree<Integer> search = new KNearestNeighborSearchOnKDTree<>(tree, k);
                search.search(query);
                double boundary = search.getSquareDistance(k - 1);
                if (hasStrongerAt(search, k, boundary, maxima, p.score, c)) {
                    ranked.add(new RankedPoint(p, Math.sqrt(boundary)));
                    resolved = true;
                    break;
                }
            }
            if (!resolved) {
                unresolved++;
                if (unresolvedPolicy == UnresolvedPolicy.SENTINEL) {
                    ranked.add(new RankedPoint(p, rmax));
                }
            }
        }
        log.debug("kd-tree ranking: {} candidates, {} without stronger neighbour ({})", nm, unresolved, unresolvedPolicy);
        return ranked;
    }

    /**
     * Có lân cận nào nằm đúng trên khoảng cách biên và mạnh hơn c lần điểm đang xét không.
     */
    private static boolean hasStrongerAt(KNearestNeighborSearchOnKDTree<Integer> search, int k, double boundary,
                                         List<CandidatePoint> maxima, double score, double c) {
        for (int j = k - 1; j >= 1; j--) {
            if (search.getSquareDistance(j) < boundary) break;
            CandidatePoint neighbour = maxima.get(search.getSampler(j).get());
            if (score < c * neighbour.score) return true;
        }
        return false;
    }
}
