package com.hybridrag.ingest;

public record StoreStats(int documents, int chunks, String embeddingVersion) {
}
