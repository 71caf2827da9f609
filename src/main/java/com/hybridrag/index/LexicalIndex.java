package com.hybridrag.index;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface LexicalIndex extends Closeable {
    default void insert(long chunkId, String content) throws IndexUnavailableException {
        replace(List.of(), Map.of(chunkId, content));
    }

    void replace(Collection<Long> removed, Map<Long, String> added) throws IndexUnavailableException;

    List<ScoredChunk> query(String text, int k) throws IndexUnavailableException;

    void clear() throws IndexUnavailableException;
}
