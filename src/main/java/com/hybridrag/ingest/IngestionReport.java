package com.hybridrag.ingest;

public record IngestionReport(String sourceUri, long documentId, int chunksCreated, int chunksReplaced) {
}
