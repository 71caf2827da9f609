package com.hybridrag.ingest;

public record ChunkRecord(long id, long documentId, String content, int ordinal, int tokenCount, float[] embedding) {
}
