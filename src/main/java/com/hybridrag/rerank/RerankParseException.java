package com.hybridrag.rerank;

class RerankParseException extends Exception {
    RerankParseException(String message) {
        super(message);
    }

    RerankParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
