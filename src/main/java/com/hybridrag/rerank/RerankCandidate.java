package com.hybridrag.rerank;

public record RerankCandidate(long chunkId, String content) {
}
