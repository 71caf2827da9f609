package com.hybridrag.index;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface VectorIndex {
    default void insert(long chunkId, float[] vector) throws IndexUnavailableException {
        replace(List.of(), Map.of(chunkId, vector));
    }

    void replace(Collection<Long> removed, Map<Long, float[]> added) throws IndexUnavailableException;

    List<ScoredChunk> query(float[] vector, int k) throws IndexUnavailableException;

    void refresh();

    void clear();

    int size();
}
