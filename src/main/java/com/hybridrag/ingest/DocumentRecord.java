package com.hybridrag.ingest;

import java.time.Instant;

public record DocumentRecord(long id, String sourceUri, String title, ChunkingStrategy strategy, Instant createdAt) {
}
