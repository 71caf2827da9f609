package com.hybridrag.retrieval;

import java.time.Duration;

public record QueryRequest(
        String text,
        Integer limit,
        SearchMode mode,
        Integer diversityCap,
        Duration timeout,
        Boolean rerank) {
    public QueryRequest {
        if (text == null) {
            throw new IllegalArgumentException("query text is required");
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (diversityCap != null && diversityCap <= 0) {
            throw new IllegalArgumentException("diversityCap must be positive");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        mode = mode == null ? SearchMode.HYBRID : mode;
    }

    public static QueryRequest of(String text) {
        return new QueryRequest(text, null, SearchMode.HYBRID, null, null, null);
    }

    public QueryRequest withLimit(int value) {
        return new QueryRequest(text, value, mode, diversityCap, timeout, rerank);
    }

    public QueryRequest withMode(SearchMode value) {
        return new QueryRequest(text, limit, value, diversityCap, timeout, rerank);
    }

    public QueryRequest withDiversityCap(Integer value) {
        return new QueryRequest(text, limit, mode, value, timeout, rerank);
    }

    public QueryRequest withTimeout(Duration value) {
        return new QueryRequest(text, limit, mode, diversityCap, value, rerank);
    }

    public QueryRequest withRerank(Boolean value) {
        return new QueryRequest(text, limit, mode, diversityCap, timeout, value);
    }
}
