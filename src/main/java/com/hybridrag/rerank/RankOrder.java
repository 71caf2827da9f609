package com.hybridrag.rerank;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class RankOrder {
    private RankOrder() {
    }

    static List<Long> byScore(List<RerankCandidate> candidates, double[] scores, int topN) {
        List<Integer> positions = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            positions.add(i);
        }
        positions.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());
        return positions.stream()
                .limit(Math.max(0, topN))
                .map(i -> candidates.get(i).chunkId())
                .toList();
    }
}
