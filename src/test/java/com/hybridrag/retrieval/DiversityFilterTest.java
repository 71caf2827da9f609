package com.hybridrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

class DiversityFilterTest {

    @Test
    void shouldCapResultsPerDocumentAndKeepRankOrder() {
        List<RetrievedChunk> ranked = List.of(
                result(1, 10), result(2, 10), result(3, 10), result(4, 20), result(5, 30), result(6, 20));

        List<RetrievedChunk> capped = DiversityFilter.apply(ranked, 1, 5);

        assertEquals(List.of(1L, 4L, 5L), capped.stream().map(RetrievedChunk::chunkId).toList());
    }

    @Test
    void shouldTruncateToLimitAfterCapping() {
        List<RetrievedChunk> ranked = List.of(
                result(1, 10), result(2, 10), result(3, 10), result(4, 20), result(5, 20));

        assertEquals(List.of(1L, 2L, 4L), DiversityFilter.apply(ranked, 2, 3).stream().map(RetrievedChunk::chunkId).toList());
        assertEquals(List.of(1L, 2L), DiversityFilter.apply(ranked, null, 2).stream().map(RetrievedChunk::chunkId).toList());
    }

    private static RetrievedChunk result(long chunkId, long documentId) {
        return new RetrievedChunk(chunkId, documentId, "doc-" + documentId, "Doc", 0, "content", 1d / chunkId, Provenance.BOTH);
    }
}
