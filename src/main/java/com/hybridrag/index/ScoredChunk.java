package com.hybridrag.index;

public record ScoredChunk(long chunkId, double score) {
}
