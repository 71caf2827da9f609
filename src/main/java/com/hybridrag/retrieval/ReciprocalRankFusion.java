package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted reciprocal rank fusion. An id at 1-based position {@code rank} of a list contributes
 * {@code weight / (k + rank)}; contributions are summed across lists. Only ranks matter, so lists
 * with incomparable score scales fuse cleanly.
 */
public class ReciprocalRankFusion {
    public static final int DEFAULT_K = 60;
    private static final Comparator<FusedScore> ORDER = Comparator
            .comparingDouble(FusedScore::score).reversed()
            .thenComparingLong(FusedScore::chunkId);

    private final int k;

    public ReciprocalRankFusion() {
        this(DEFAULT_K);
    }

    public ReciprocalRankFusion(int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        this.k = k;
    }

    public List<FusedScore> fuse(List<List<Long>> rankings) {
        return fuse(rankings, Collections.nCopies(rankings.size(), 1.0));
    }

    public List<FusedScore> fuse(List<List<Long>> rankings, List<Double> weights) {
        if (rankings.size() != weights.size()) {
            throw new IllegalArgumentException("Expected one weight per ranking, got " + weights.size() + " for " + rankings.size());
        }
        Map<Long, Double> scores = new LinkedHashMap<>();
        for (int list = 0; list < rankings.size(); list++) {
            double weight = weights.get(list);
            if (weight < 0d || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Weights must be non-negative");
            }
            Set<Long> seen = new HashSet<>();
            List<Long> ranking = rankings.get(list);
            for (int position = 0; position < ranking.size(); position++) {
                Long chunkId = ranking.get(position);
                if (seen.add(chunkId)) {
                    scores.merge(chunkId, weight / (k + position + 1), Double::sum);
                }
            }
        }
        List<FusedScore> fused = new ArrayList<>(scores.size());
        scores.forEach((chunkId, score) -> fused.add(new FusedScore(chunkId, score)));
        fused.sort(ORDER);
        return fused;
    }

    public int k() {
        return k;
    }

    public record FusedScore(long chunkId, double score) {
    }
}
