package com.hybridrag.ingest;

public class IngestException extends Exception {
    public enum Kind {
        PARSE,
        EMBEDDING,
        CONCURRENT_INGESTION,
        MODEL_MISMATCH,
        INDEX
    }

    private final String sourceUri;
    private final Kind kind;

    public IngestException(String sourceUri, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.sourceUri = sourceUri;
        this.kind = kind;
    }

    public String sourceUri() {
        return sourceUri;
    }

    public Kind kind() {
        return kind;
    }
}
