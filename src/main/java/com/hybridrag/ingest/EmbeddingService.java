package com.hybridrag.ingest;

import java.util.List;

public interface EmbeddingService {
    List<float[]> embed(List<String> batch) throws EmbeddingException;

    int dimension();

    default String version() {
        return "unversioned-" + dimension();
    }

    default float[] embed(String text) throws EmbeddingException {
        List<float[]> vectors = embed(List.of(text));
        if (vectors.size() != 1) {
            throw new EmbeddingException("Expected 1 vector but received " + vectors.size(), List.of(text));
        }
        return vectors.get(0);
    }
}
