package com.hybridrag.index;

public class IndexUnavailableException extends Exception {
    private final String indexName;

    public IndexUnavailableException(String indexName, String message, Throwable cause) {
        super(indexName + " index unavailable: " + message, cause);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
