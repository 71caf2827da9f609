package com.hybridrag.ingest;

public class ParseException extends Exception {
    private final String sourceUri;

    public ParseException(String sourceUri, String message) {
        super(message);
        this.sourceUri = sourceUri;
    }

    public ParseException(String sourceUri, String message, Throwable cause) {
        super(message, cause);
        this.sourceUri = sourceUri;
    }

    public String sourceUri() {
        return sourceUri;
    }
}
