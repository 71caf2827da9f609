package com.hybridrag.ingest;

public record ChunkingOptions(ChunkingStrategy strategy, int minTokens, int maxTokens, int overlapTokens) {
    public ChunkingOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (minTokens < 0 || maxTokens <= 0 || minTokens > maxTokens) {
            throw new IllegalArgumentException("Invalid token bounds min=" + minTokens + " max=" + maxTokens);
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException("overlapTokens must be in [0, maxTokens)");
        }
    }

    public ChunkingOptions withStrategy(ChunkingStrategy other) {
        return new ChunkingOptions(other, minTokens, maxTokens, overlapTokens);
    }
}
