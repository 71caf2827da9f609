package com.hybridrag.retrieval;

import java.util.List;

public record QueryResponse(
        List<RetrievedChunk> results,
        List<String> warnings,
        SearchMode requestedMode,
        SearchMode effectiveMode,
        boolean reranked) {
    public QueryResponse {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
    }

    public boolean degraded() {
        return requestedMode != effectiveMode;
    }
}
