package com.hybridrag.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LuceneLexicalIndexTest {
    private final LuceneLexicalIndex index = new LuceneLexicalIndex();

    @AfterEach
    void tearDown() throws Exception {
        index.close();
    }

    @Test
    void shouldMatchStemmedForms() throws Exception {
        index.insert(1L, "The runners were running quickly through the park");
        index.insert(2L, "Bananas are rich in potassium");

        assertEquals(List.of(1L), ids(index.query("run", 10)));
        assertEquals(List.of(2L), ids(index.query("banana", 10)));
    }

    @Test
    void shouldIgnoreStopwordOnlyQueries() throws Exception {
        index.insert(1L, "the quick brown fox");

        assertTrue(index.query("the and of", 10).isEmpty());
        assertTrue(index.query("   ", 10).isEmpty());
    }

    @Test
    void shouldTreatQueryAsNaturalLanguageRatherThanSyntax() throws Exception {
        index.insert(1L, "dogs chase cats");

        assertEquals(List.of(1L), ids(index.query("dogs AND (cats OR \"birds", 10)));
        assertEquals(List.of(1L), ids(index.query("cats:* NOT -dogs~", 10)));
    }

    @Test
    void shouldRankMoreRelevantChunkFirst() throws Exception {
        index.replace(List.of(), Map.of(
                1L, "vector search with hybrid ranking",
                2L, "hybrid hybrid hybrid retrieval uses hybrid fusion",
                3L, "unrelated gardening notes"));

        List<Long> hits = ids(index.query("hybrid", 10));

        assertEquals(List.of(2L, 1L), hits);
    }

    @Test
    void shouldDropReplacedAndClearedChunks() throws Exception {
        index.insert(1L, "original wording about glaciers");
        index.replace(List.of(1L), Map.of(2L, "revised wording about glaciers"));

        assertEquals(List.of(2L), ids(index.query("glacier", 10)));

        index.clear();

        assertTrue(index.query("glacier", 10).isEmpty());
    }

    @Test
    void shouldReportUnavailableAfterClose() throws Exception {
        index.insert(1L, "text");
        index.close();

        assertThrows(IndexUnavailableException.class, () -> index.query("text", 1));
    }

    private static List<Long> ids(List<ScoredChunk> hits) {
        return hits.stream().map(ScoredChunk::chunkId).toList();
    }
}
