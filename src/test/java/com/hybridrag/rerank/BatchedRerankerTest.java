package com.hybridrag.rerank;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

class BatchedRerankerTest {
    private static final List<RerankCandidate> CANDIDATES = List.of(
            new RerankCandidate(1L, "first"),
            new RerankCandidate(2L, "second"),
            new RerankCandidate(3L, "third"));

    @Test
    void shouldOrderByJudgedScores() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "{\"scores\":[1,9,5]}");

        assertEquals(List.of(2L, 3L, 1L), reranker.rerank("q", CANDIDATES, 3));
    }

    @Test
    void shouldReadBareArrayWrappedInProse() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "Sure, here you go: [2.5, 0.5, 7] hope it helps");

        assertEquals(List.of(3L, 1L, 2L), reranker.rerank("q", CANDIDATES, 3));
    }

    @Test
    void shouldTruncateToTopN() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "[3,2,1]");

        assertEquals(List.of(1L, 2L), reranker.rerank("q", CANDIDATES, 2));
    }

    @Test
    void shouldKeepInputOrderWhenScoreCountIsWrong() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "{\"scores\":[9,1]}");

        assertEquals(List.of(1L, 2L, 3L), reranker.rerank("q", CANDIDATES, 3));
    }

    @Test
    void shouldKeepInputOrderWhenScoresAreNotNumbers() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "{\"scores\":[1,\"high\",3]}");

        assertEquals(List.of(1L, 2L, 3L), reranker.rerank("q", CANDIDATES, 3));
    }

    @Test
    void shouldKeepInputOrderWhenJudgeFails() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> {
            throw new IOException("judge offline");
        });

        assertEquals(List.of(1L, 2L), reranker.rerank("q", CANDIDATES, 2));
    }

    @Test
    void shouldReturnNothingForNoCandidates() {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> {
            throw new AssertionError("judge must not be called");
        });

        assertTrue(reranker.rerank("q", List.of(), 5).isEmpty());
    }

    @Test
    void shouldRejectUnparseableReplies() throws Exception {
        BatchedReranker reranker = new BatchedReranker((query, documents) -> "");

        assertArrayEquals(new double[] { 1.0, 2.0 }, reranker.parseScores("{\"scores\":[1,2]}", 2));
        assertThrows(RerankParseException.class, () -> reranker.parseScores("", 2));
        assertThrows(RerankParseException.class, () -> reranker.parseScores("no json here", 2));
        assertThrows(RerankParseException.class, () -> reranker.parseScores("{\"ranking\":[1,2]}", 2));
    }
}
