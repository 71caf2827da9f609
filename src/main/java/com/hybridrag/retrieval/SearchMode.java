package com.hybridrag.retrieval;

import java.util.Locale;

public enum SearchMode {
    VECTOR,
    KEYWORD,
    HYBRID;

    public static SearchMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "vector", "semantic" -> VECTOR;
            case "keyword", "lexical", "text" -> KEYWORD;
            case "hybrid" -> HYBRID;
            default -> throw new IllegalArgumentException("Unknown search mode: " + value);
        };
    }
}
