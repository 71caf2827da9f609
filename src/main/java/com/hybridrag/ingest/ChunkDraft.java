package com.hybridrag.ingest;

public record ChunkDraft(int ordinal, String content, int tokenCount) {
}
