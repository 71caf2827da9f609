package com.hybridrag.retrieval;

import java.time.Duration;

public record RetrievalOptions(
        int defaultLimit,
        int overfetchFactor,
        int rrfK,
        double vectorWeight,
        double lexicalWeight,
        Duration timeout,
        boolean rerankByDefault,
        int rerankDepth) {
    public RetrievalOptions {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        if (overfetchFactor < 1) {
            throw new IllegalArgumentException("overfetchFactor must be at least 1");
        }
        if (rrfK <= 0) {
            throw new IllegalArgumentException("rrfK must be positive");
        }
        if (vectorWeight < 0d || lexicalWeight < 0d) {
            throw new IllegalArgumentException("RRF weights must be non-negative");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (rerankDepth < 0) {
            throw new IllegalArgumentException("rerankDepth must be non-negative");
        }
    }

    public static RetrievalOptions defaults() {
        return new RetrievalOptions(5, 2, ReciprocalRankFusion.DEFAULT_K, 1.0, 1.0, Duration.ofSeconds(10), false, 0);
    }
}
