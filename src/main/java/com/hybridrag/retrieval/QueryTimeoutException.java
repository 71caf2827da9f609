package com.hybridrag.retrieval;

public class QueryTimeoutException extends RetrievalException {
    public QueryTimeoutException(String message) {
        super(message);
    }
}
