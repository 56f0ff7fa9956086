package com.cornerdetect.ANMS;

import com.cornerdetect.exception.InvalidParameterException;
import com.cornerdetect.imageOperator.Matrix_Image;
import edu.princeton.cs.algorithms.MinPQ;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Adaptive Non-Maximal Suppression: chọn n góc mạnh và phân bố đều trong ảnh.
 * <ol>
 *     <li>Cắt biên {@code edge} pixel (0 = không cắt).</li>
 *     <li>Ngưỡng mean(H) + std(H) hoặc min(H).</li>
 *     <li>Lấy các cực đại cục bộ, tính bán kính triệt tiêu bằng {@link NeighborRanking}.</li>
 *     <li>Giữ n điểm bán kính lớn nhất bằng heap (bằng nhau thì theo thứ tự quét), cộng lại offset edge.</li>
 * </ol>
 */
@Slf4j
@Getter
public class AnmsSelector {

    private final NeighborRanking ranking;

    public AnmsSelector(NeighborRanking ranking) {
        this.ranking = ranking;
    }

    public static AnmsSelector forVariant(AnmsVariant variant, UnresolvedPolicy unresolvedPolicy) {
        if (variant == null) throw new InvalidParameterException("Thiếu biến thể ANMS");
        switch (variant) {
            case BRUTE_FORCE:
                return new AnmsSelector(new BruteForceRanking());
            case KD_TREE:
                return new AnmsSelector(new KdTreeRanking(
                        unresolvedPolicy == null ? UnresolvedPolicy.OMIT : unresolvedPolicy));
            default:
                throw new InvalidParameterException("Biến thể ANMS không hỗ trợ: " + variant);
        }
    }

    public static AnmsResult anms(double[][] h) {
        return anms(h, AnmsConfig.DEFAULT_N, AnmsConfig.DEFAULT_C, AnmsConfig.DEFAULT_USE_THRESHOLD);
    }

    /** Biến thể brute force, không cắt biên. */
    public static AnmsResult anms(double[][] h, int n, double c, boolean useThreshold) {
        return new AnmsSelector(new BruteForceRanking()).select(h, n, c, 0, useThreshold);
    }

    public static AnmsResult anmsKdTree(double[][] h) {
        return anmsKdTree(h, AnmsConfig.DEFAULT_N, AnmsConfig.DEFAULT_C, AnmsConfig.DEFAULT_EDGE,
                AnmsConfig.DEFAULT_USE_THRESHOLD);
    }

    /** Biến thể kd-tree; điểm không tìm được lân cận mạnh hơn bị bỏ qua. */
    public static AnmsResult anmsKdTree(double[][] h, int n, double c, int edge, boolean useThreshold) {
        return new AnmsSelector(new KdTreeRanking(UnresolvedPolicy.OMIT)).select(h, n, c, edge, useThreshold);
    }

    public AnmsResult select(double[][] h, int n, double c, int edge, boolean useThreshold) {
        Matrix_Image.checkImage(h);
        if (n < 0) throw new InvalidParameterException("n phải >= 0: " + n);
        if (!(c > 0)) throw new InvalidParameterException("c phải > 0: " + c);
        if (edge < 0) throw new InvalidParameterException("edge phải >= 0: " + edge);

        double[][] trimmed = edge > 0 ? Matrix_Image.crop(h, edge) : h;
        if (trimmed.length == 0) {
            log.debug("edge={} cắt hết bản đồ {}x{}, không có góc", edge, h.length, h[0].length);
            return AnmsResult.empty();
        }

        double thresh = useThreshold
                ? Matrix_Image.mean(trimmed) + Matrix_Image.std(trimmed)
                : Matrix_Image.min(trimmed);
        List<CandidatePoint> maxima = LocalMaxima.getMaxima(trimmed, thresh);

        int side = Math.max(trimmed.length, trimmed[0].length);
        double rmax = (double) side * side;

        List<RankedPoint> ranked = ranking.rank(maxima, c, rmax);

        List<RankedPoint> selected = new ArrayList<>(Math.min(n, ranked.size()));
        for (RankedPoint p : topN(ranked, n)) {
            selected.add(p.shifted(edge));
        }
        log.debug("ANMS {}: threshold={}, {} maxima, {} ranked, {} selected",
                ranking.getClass().getSimpleName(), thresh, maxima.size(), ranked.size(), selected.size());
        return new AnmsResult(selected);
    }

    /**
     * n điểm có bán kính lớn nhất, giảm dần; bán kính bằng nhau giữ thứ tự trong {@code ranked}.
     * Heap chỉ giữ n phần tử, đỉnh heap là điểm "yếu" nhất đang được giữ.
     */
    static List<RankedPoint> topN(List<RankedPoint> ranked, int n) {
        if (n == 0 || ranked.isEmpty()) return new ArrayList<>();

        // nhỏ hơn = yếu hơn: bán kính nhỏ hơn, hoặc bằng nhau mà đứng sau
        Comparator<Integer> weakerFirst = (a, b) -> {
            int cmp = RankedPoint.BY_RADIUS_DESC.compare(ranked.get(b), ranked.get(a));
            return cmp != 0 ? cmp : Integer.compare(b, a);
        };
        MinPQ<Integer> kept = new MinPQ<>(Math.min(n, ranked.size()), weakerFirst);
        for (int i = 0; i < ranked.size(); i++) {
            if (kept.size() < n) {
                kept.insert(i);
            } else if (weakerFirst.compare(i, kept.min()) > 0) {
                kept.delMin();
                kept.insert(i);
            }
        }

        RankedPoint[] out = new RankedPoint[kept.size()];
        for (int j = out.length - 1; j >= 0; j--) {
            out[j] = ranked.get(kept.delMin());
        }
        return Arrays.asList(out);
    }
}
