package com.hybridrag.retrieval;

public record RetrievedChunk(
        long chunkId,
        long documentId,
        String source,
        String title,
        int ordinal,
        String content,
        double score,
        Provenance provenance) {
}
