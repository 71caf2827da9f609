package com.hybridrag.ingest;

import java.util.List;

public class EmbeddingException extends Exception {
    private final List<String> batch;
    private final boolean rateLimited;

    public EmbeddingException(String message, List<String> batch) {
        this(message, batch, false, null);
    }

    public EmbeddingException(String message, List<String> batch, boolean rateLimited, Throwable cause) {
        super(message, cause);
        this.batch = List.copyOf(batch);
        this.rateLimited = rateLimited;
    }

    public List<String> batch() {
        return batch;
    }

    public boolean rateLimited() {
        return rateLimited;
    }
}
