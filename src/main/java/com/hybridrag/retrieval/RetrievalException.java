package com.hybridrag.retrieval;

public class RetrievalException extends Exception {
    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
