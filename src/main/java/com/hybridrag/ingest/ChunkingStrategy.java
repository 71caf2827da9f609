package com.hybridrag.ingest;

public enum ChunkingStrategy {
    PARAGRAPH,
    FIXED_WINDOW;

    public Chunker newChunker(int overlapTokens) {
        return switch (this) {
            case PARAGRAPH -> new ParagraphChunker(overlapTokens);
            case FIXED_WINDOW -> new FixedWindowChunker(overlapTokens);
        };
    }
}
