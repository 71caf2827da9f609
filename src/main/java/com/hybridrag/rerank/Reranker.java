package com.hybridrag.rerank;

import java.util.List;

public interface Reranker {
    // judge failures fall back to the input order instead of throwing
    List<Long> rerank(String query, List<RerankCandidate> candidates, int topN);

    static List<Long> inputOrder(List<RerankCandidate> candidates, int topN) {
        return candidates.stream()
                .limit(Math.max(0, topN))
                .map(RerankCandidate::chunkId)
                .toList();
    }
}
