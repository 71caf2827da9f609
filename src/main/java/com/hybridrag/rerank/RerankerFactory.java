package com.hybridrag.rerank;

import okhttp3.OkHttpClient;

public final class RerankerFactory {
    private RerankerFactory() {
    }

    public static Reranker fromEnvironment(OkHttpClient httpClient, RerankStrategy strategy, int maxConcurrency) {
        String endpoint = System.getenv("HYBRIDRAG_JUDGE_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return create(new LexicalOverlapJudge(), strategy, maxConcurrency);
        }
        return create(new HttpRelevanceJudge(httpClient, endpoint, System.getenv("HYBRIDRAG_JUDGE_API_KEY")), strategy, maxConcurrency);
    }

    public static <J extends RelevanceJudge & BatchRelevanceJudge> Reranker create(J judge, RerankStrategy strategy, int maxConcurrency) {
        return switch (strategy) {
            case PER_CANDIDATE -> new PerCandidateReranker(judge, maxConcurrency);
            case BATCHED -> new BatchedReranker(judge);
        };
    }
}
