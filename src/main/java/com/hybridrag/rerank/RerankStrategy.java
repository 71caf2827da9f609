package com.hybridrag.rerank;

public enum RerankStrategy {
    PER_CANDIDATE,
    BATCHED
}
