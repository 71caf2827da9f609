package com.hybridrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hybridrag.index.BucketedVectorIndex;
import com.hybridrag.index.IndexUnavailableException;
import com.hybridrag.index.LexicalIndex;
import com.hybridrag.index.LuceneLexicalIndex;
import com.hybridrag.index.ScoredChunk;
import com.hybridrag.ingest.BatchIngestionSummary;
import com.hybridrag.ingest.ChunkStore;
import com.hybridrag.ingest.ChunkingOptions;
import com.hybridrag.ingest.ChunkingStrategy;
import com.hybridrag.ingest.EmbeddingException;
import com.hybridrag.ingest.EmbeddingService;
import com.hybridrag.ingest.FileDocumentParser;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.ingest.LocalModelEmbeddingService;
import com.hybridrag.rerank.Reranker;

class QueryServiceTest {
    private static final EmbeddingService FAILING_EMBEDDER = new EmbeddingService() {
        @Override
        public List<float[]> embed(List<String> batch) throws EmbeddingException {
            throw new EmbeddingException("embedding provider offline", batch);
        }

        @Override
        public int dimension() {
            return 64;
        }
    };

    private static final LexicalIndex BROKEN_LEXICAL = new LexicalIndex() {
        @Override
        public void replace(Collection<Long> removed, Map<Long, String> added) throws IndexUnavailableException {
            throw new IndexUnavailableException("lexical", "offline", null);
        }

        @Override
        public List<ScoredChunk> query(String text, int k) throws IndexUnavailableException {
            throw new IndexUnavailableException("lexical", "offline", null);
        }

        @Override
        public void clear() throws IndexUnavailableException {
            throw new IndexUnavailableException("lexical", "offline", null);
        }

        @Override
        public void close() {
        }
    };

    @TempDir
    Path tempDir;

    private ChunkStore store;
    private BucketedVectorIndex vectorIndex;
    private LuceneLexicalIndex lexicalIndex;
    private EmbeddingService embedder;
    private ExecutorService workers;

    @BeforeEach
    void setUp() throws Exception {
        store = new ChunkStore();
        vectorIndex = new BucketedVectorIndex();
        lexicalIndex = new LuceneLexicalIndex();
        embedder = new LocalModelEmbeddingService(64);
        workers = Executors.newFixedThreadPool(4);

        write("solar.md", """
                Solar panels convert sunlight into electricity for homes and offices daily.

                Rooftop solar panels need regular cleaning to keep output high always.

                Solar inverters translate panel current into grid ready alternating power.
                """);
        write("wind.md", "Wind turbines and solar farms often share the same transmission lines.");
        write("ocean.md", """
                Ocean tides rise and fall twice each day near the coast.

                Tidal power stations capture energy from moving sea water currents.
                """);
        IngestionService ingestion = new IngestionService(
                store,
                vectorIndex,
                lexicalIndex,
                new FileDocumentParser(List.of(".md")),
                embedder,
                new ChunkingOptions(ChunkingStrategy.PARAGRAPH, 5, 12, 2),
                10,
                workers);
        BatchIngestionSummary summary = ingestion.ingestDirectory(tempDir);
        assertEquals(3, summary.succeeded());
    }

    @AfterEach
    void tearDown() throws Exception {
        workers.shutdownNow();
        lexicalIndex.close();
    }

    @Test
    void shouldOnlyTagHybridResultsWithBranchesThatFoundThem() throws Exception {
        QueryService service = service(embedder, lexicalIndex, null);
        for (String query : List.of("solar panels", "tidal energy", "wind transmission", "cleaning output")) {
            for (int limit : List.of(1, 2, 3)) {
                int breadth = limit * RetrievalOptions.defaults().overfetchFactor();
                Set<Long> vectorOnly = hitIds(vectorIndex.query(embedder.embed(query), breadth));
                Set<Long> keywordOnly = hitIds(lexicalIndex.query(query, breadth));

                QueryResponse hybrid = service.query(QueryRequest.of(query).withLimit(limit));

                assertTrue(hybrid.results().size() <= limit);
                for (RetrievedChunk result : hybrid.results()) {
                    boolean fromVector = result.provenance() != Provenance.LEXICAL;
                    boolean fromKeyword = result.provenance() != Provenance.VECTOR;
                    assertEquals(fromVector, vectorOnly.contains(result.chunkId()),
                            () -> "vector tag mismatch for " + query + " chunk " + result.chunkId());
                    assertEquals(fromKeyword, keywordOnly.contains(result.chunkId()),
                            () -> "keyword tag mismatch for " + query + " chunk " + result.chunkId());
                }
            }
        }
    }

    @Test
    void shouldClampFetchSizeForHugeLimits() throws Exception {
        QueryService service = service(embedder, lexicalIndex, null);
        int huge = Integer.MAX_VALUE / 2 + 1;

        assertEquals(Integer.MAX_VALUE, QueryService.fetchSize(huge, 2));
        assertEquals(10, QueryService.fetchSize(5, 2));
        assertEquals(4, service.query(QueryRequest.of("solar").withLimit(huge).withMode(SearchMode.KEYWORD)).results().size());
        assertEquals(6, service.query(QueryRequest.of("solar").withLimit(huge)).results().size());
        assertEquals(6, service.query(QueryRequest.of("solar").withLimit(Integer.MAX_VALUE).withMode(SearchMode.VECTOR)).results().size());
    }

    @Test
    void shouldReturnKeywordMatchesWithLexicalProvenance() throws Exception {
        QueryResponse response = service(embedder, lexicalIndex, null)
                .query(QueryRequest.of("solar").withLimit(10).withMode(SearchMode.KEYWORD));

        assertEquals(4, response.results().size());
        assertEquals(SearchMode.KEYWORD, response.effectiveMode());
        for (RetrievedChunk result : response.results()) {
            assertTrue(result.content().toLowerCase(Locale.ROOT).contains("solar"));
            assertEquals(Provenance.LEXICAL, result.provenance());
        }
    }

    @Test
    void shouldTagChunksFoundByBothBranches() throws Exception {
        QueryResponse response = service(embedder, lexicalIndex, null).query(QueryRequest.of("solar panels").withLimit(6));

        assertEquals(6, response.results().size());
        assertEquals(SearchMode.HYBRID, response.effectiveMode());
        for (RetrievedChunk result : response.results()) {
            boolean mentionsSolar = result.content().toLowerCase(Locale.ROOT).contains("solar");
            assertEquals(mentionsSolar ? Provenance.BOTH : Provenance.VECTOR, result.provenance());
        }
        assertTrue(response.results().get(0).content().contains("panel"));
    }

    @Test
    void shouldCapResultsPerDocument() throws Exception {
        QueryResponse response = service(embedder, lexicalIndex, null)
                .query(QueryRequest.of("solar").withLimit(5).withMode(SearchMode.KEYWORD).withDiversityCap(1));

        assertEquals(2, response.results().size());
        assertEquals(2, response.results().stream().map(RetrievedChunk::documentId).distinct().count());
    }

    @Test
    void shouldDegradeHybridToKeywordWhenQueryEmbeddingFails() throws Exception {
        QueryResponse response = service(FAILING_EMBEDDER, lexicalIndex, null).query(QueryRequest.of("tidal power"));

        assertFalse(response.results().isEmpty());
        assertTrue(response.degraded());
        assertEquals(SearchMode.KEYWORD, response.effectiveMode());
        assertTrue(response.warnings().get(0).contains("embedding"));
        response.results().forEach(result -> assertEquals(Provenance.LEXICAL, result.provenance()));
    }

    @Test
    void shouldDegradeHybridToVectorWhenLexicalIndexIsUnavailable() throws Exception {
        QueryResponse response = service(embedder, BROKEN_LEXICAL, null).query(QueryRequest.of("tidal power"));

        assertFalse(response.results().isEmpty());
        assertEquals(SearchMode.VECTOR, response.effectiveMode());
        assertTrue(response.warnings().get(0).contains("lexical index unavailable"));
    }

    @Test
    void shouldFailSingleModeAndDoublyBrokenHybridWithTypedError() {
        assertThrows(RetrievalException.class,
                () -> service(FAILING_EMBEDDER, lexicalIndex, null).query(QueryRequest.of("solar").withMode(SearchMode.VECTOR)));
        assertThrows(RetrievalException.class,
                () -> service(embedder, BROKEN_LEXICAL, null).query(QueryRequest.of("solar").withMode(SearchMode.KEYWORD)));
        assertThrows(RetrievalException.class,
                () -> service(FAILING_EMBEDDER, BROKEN_LEXICAL, null).query(QueryRequest.of("solar")));
    }

    @Test
    void shouldDistinguishEmptyResultsFromFailures() throws Exception {
        QueryService service = service(embedder, lexicalIndex, null);

        assertTrue(service.query(QueryRequest.of("xylophone").withMode(SearchMode.KEYWORD)).results().isEmpty());
        assertTrue(service.query(QueryRequest.of("   ")).results().isEmpty());
    }

    @Test
    void shouldSkipIndexHitsWhoseChunksLeftTheStore() throws Exception {
        String solar = tempDir.resolve("solar.md").toAbsolutePath().normalize().toString();
        assertTrue(store.purge(solar).isPresent());

        QueryResponse response = service(embedder, lexicalIndex, null)
                .query(QueryRequest.of("solar").withLimit(10).withMode(SearchMode.KEYWORD));

        assertEquals(1, response.results().size());
        assertTrue(response.results().get(0).source().endsWith("wind.md"));
        assertTrue(response.warnings().isEmpty());
    }

    @Test
    void shouldTimeOutInsteadOfBlockingOnSlowBranch() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        EmbeddingService stalled = new EmbeddingService() {
            @Override
            public List<float[]> embed(List<String> batch) throws EmbeddingException {
                try {
                    never.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new EmbeddingException("interrupted", batch);
            }

            @Override
            public int dimension() {
                return 64;
            }
        };
        QueryService service = service(stalled, lexicalIndex, null);

        try {
            long started = System.nanoTime();
            assertThrows(QueryTimeoutException.class,
                    () -> service.query(QueryRequest.of("solar").withTimeout(Duration.ofMillis(150))));
            assertThrows(QueryTimeoutException.class,
                    () -> service.query(QueryRequest.of("solar").withMode(SearchMode.VECTOR).withTimeout(Duration.ofMillis(150))));
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
        } finally {
            never.countDown();
        }
    }

    @Test
    void shouldApplyRerankerToFusedHead() throws Exception {
        Reranker reversing = (query, candidates, topN) -> {
            List<Long> ids = new ArrayList<>(candidates.stream().map(candidate -> candidate.chunkId()).toList());
            Collections.reverse(ids);
            return ids;
        };
        QueryService service = service(embedder, lexicalIndex, reversing);
        QueryRequest request = QueryRequest.of("solar").withLimit(4).withMode(SearchMode.KEYWORD);

        List<Long> plain = orderedIds(service.query(request.withRerank(false)));
        QueryResponse reranked = service.query(request.withRerank(true));

        List<Long> expected = new ArrayList<>(plain);
        Collections.reverse(expected);
        assertTrue(reranked.reranked());
        assertEquals(expected, orderedIds(reranked));
    }

    @Test
    void shouldKeepPreRerankOrderWhenRerankerMissesDeadline() throws Exception {
        Reranker slow = (query, candidates, topN) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        QueryService service = service(embedder, lexicalIndex, slow);
        QueryRequest request = QueryRequest.of("solar").withLimit(4).withMode(SearchMode.KEYWORD).withTimeout(Duration.ofMillis(500));

        List<Long> plain = orderedIds(service.query(request.withRerank(false)));
        QueryResponse response = service.query(request.withRerank(true));

        assertFalse(response.reranked());
        assertEquals(plain, orderedIds(response));
        assertTrue(response.warnings().get(0).startsWith("Rerank exceeded"));
    }

    private QueryService service(EmbeddingService embeddingService, LexicalIndex lexical, Reranker reranker) {
        return new QueryService(store, vectorIndex, lexical, embeddingService, reranker, RetrievalOptions.defaults(), workers);
    }

    private void write(String name, String content) throws Exception {
        Files.writeString(tempDir.resolve(name), content);
    }

    private static Set<Long> hitIds(List<ScoredChunk> hits) {
        Set<Long> ids = new HashSet<>();
        hits.forEach(hit -> ids.add(hit.chunkId()));
        return ids;
    }

    private static List<Long> orderedIds(QueryResponse response) {
        return response.results().stream().map(RetrievedChunk::chunkId).toList();
    }
}
