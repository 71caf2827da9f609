package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class DiversityFilter {
    private DiversityFilter() {
    }

    static List<RetrievedChunk> apply(List<RetrievedChunk> ranked, Integer cap, int limit) {
        List<RetrievedChunk> kept = new ArrayList<>(Math.min(limit, ranked.size()));
        Map<Long, Integer> perDocument = new HashMap<>();
        for (RetrievedChunk result : ranked) {
            if (kept.size() >= limit) {
                break;
            }
            if (cap != null) {
                int seen = perDocument.merge(result.documentId(), 1, Integer::sum);
                if (seen > cap) {
                    continue;
                }
            }
            kept.add(result);
        }
        return kept;
    }
}
