package com.hybridrag.retrieval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.index.IndexUnavailableException;
import com.hybridrag.index.LexicalIndex;
import com.hybridrag.index.ScoredChunk;
import com.hybridrag.index.VectorIndex;
import com.hybridrag.ingest.ChunkRecord;
import com.hybridrag.ingest.ChunkStore;
import com.hybridrag.ingest.DocumentRecord;
import com.hybridrag.ingest.EmbeddingException;
import com.hybridrag.ingest.EmbeddingService;
import com.hybridrag.rerank.RerankCandidate;
import com.hybridrag.rerank.Reranker;

/**
 * Answers queries in vector, keyword or hybrid mode.
 *
 * <p>Every mode fetches {@code limit * overfetchFactor} candidates so the diversity cap and the
 * reranker have room to work. Branches run on the shared worker pool under the query deadline. In
 * hybrid mode a failed branch degrades the query to the other branch with a warning; single modes
 * surface the failure as a {@link RetrievalException}.
 */
public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final ChunkStore store;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final EmbeddingService embeddingService;
    private final Reranker reranker;
    private final RetrievalOptions options;
    private final ReciprocalRankFusion fusion;
    private final ExecutorService workers;

    public QueryService(
            ChunkStore store,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            EmbeddingService embeddingService,
            Reranker reranker,
            RetrievalOptions options,
            ExecutorService workers) {
        this.store = store;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.embeddingService = embeddingService;
        this.reranker = reranker;
        this.options = options;
        this.fusion = new ReciprocalRankFusion(options.rrfK());
        this.workers = workers;
    }

    public QueryResponse query(QueryRequest request) throws RetrievalException {
        long started = System.nanoTime();
        long deadline = started + Optional.ofNullable(request.timeout()).orElse(options.timeout()).toNanos();
        int limit = request.limit() == null ? options.defaultLimit() : request.limit();
        int fetch = fetchSize(limit, options.overfetchFactor());
        String text = request.text().strip();
        List<String> warnings = new ArrayList<>();

        if (text.isEmpty()) {
            return new QueryResponse(List.of(), warnings, request.mode(), request.mode(), false);
        }

        Retrieval retrieval = switch (request.mode()) {
            case VECTOR -> single(SearchMode.VECTOR, submitVector(text, fetch), deadline);
            case KEYWORD -> single(SearchMode.KEYWORD, submitLexical(text, fetch), deadline);
            case HYBRID -> hybrid(text, fetch, deadline, warnings);
        };

        List<RetrievedChunk> ranked = hydrate(retrieval.candidates());
        boolean reranked = false;
        if (reranker != null && Optional.ofNullable(request.rerank()).orElse(options.rerankByDefault()) && ranked.size() > 1) {
            Optional<List<RetrievedChunk>> reordered = rerank(text, ranked, fetch, deadline, warnings);
            if (reordered.isPresent()) {
                ranked = reordered.get();
                reranked = true;
            }
        }
        List<RetrievedChunk> results = DiversityFilter.apply(ranked, request.diversityCap(), limit);

        log.info("query.telemetry mode={} effectiveMode={} vectorHits={} lexicalHits={} candidates={} results={} reranked={} warnings={} elapsedMs={}",
                request.mode(),
                retrieval.effectiveMode(),
                retrieval.vectorHits(),
                retrieval.lexicalHits(),
                retrieval.candidates().size(),
                results.size(),
                reranked,
                warnings.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return new QueryResponse(results, warnings, request.mode(), retrieval.effectiveMode(), reranked);
    }

    private Retrieval single(SearchMode mode, Future<List<ScoredChunk>> branch, long deadline) throws RetrievalException {
        List<ScoredChunk> hits;
        try {
            hits = await(branch, deadline, mode.name().toLowerCase(Locale.ROOT) + " branch");
        } catch (ExecutionException e) {
            throw new RetrievalException(describe(mode, e.getCause()), e.getCause());
        }
        Provenance provenance = mode == SearchMode.VECTOR ? Provenance.VECTOR : Provenance.LEXICAL;
        List<Candidate> candidates = hits.stream()
                .map(hit -> new Candidate(hit.chunkId(), hit.score(), provenance))
                .toList();
        return mode == SearchMode.VECTOR
                ? new Retrieval(mode, candidates, hits.size(), 0)
                : new Retrieval(mode, candidates, 0, hits.size());
    }

    private Retrieval hybrid(String text, int fetch, long deadline, List<String> warnings) throws RetrievalException {
        Future<List<ScoredChunk>> vectorBranch = submitVector(text, fetch);
        Future<List<ScoredChunk>> lexicalBranch = submitLexical(text, fetch);
        BranchOutcome vector;
        BranchOutcome lexical;
        try {
            vector = outcome(vectorBranch, deadline, "vector branch");
            lexical = outcome(lexicalBranch, deadline, "lexical branch");
        } catch (RetrievalException e) {
            vectorBranch.cancel(true);
            lexicalBranch.cancel(true);
            throw e;
        }

        if (vector.failure() != null && lexical.failure() != null) {
            throw new RetrievalException("Both retrieval branches failed: "
                    + describe(SearchMode.VECTOR, vector.failure()) + "; "
                    + describe(SearchMode.KEYWORD, lexical.failure()), vector.failure());
        }

        SearchMode effectiveMode = SearchMode.HYBRID;
        List<List<Long>> rankings = new ArrayList<>(2);
        List<Double> weights = new ArrayList<>(2);
        if (vector.failure() == null) {
            rankings.add(ids(vector.hits()));
            weights.add(options.vectorWeight());
        } else {
            effectiveMode = SearchMode.KEYWORD;
            degrade(warnings, describe(SearchMode.VECTOR, vector.failure()) + "; returning keyword results only");
        }
        if (lexical.failure() == null) {
            rankings.add(ids(lexical.hits()));
            weights.add(options.lexicalWeight());
        } else {
            effectiveMode = SearchMode.VECTOR;
            degrade(warnings, describe(SearchMode.KEYWORD, lexical.failure()) + "; returning vector results only");
        }

        Set<Long> fromVector = new HashSet<>(ids(vector.hits()));
        Set<Long> fromLexical = new HashSet<>(ids(lexical.hits()));
        List<Candidate> candidates = fusion.fuse(rankings, weights).stream()
                .map(fused -> new Candidate(
                        fused.chunkId(),
                        fused.score(),
                        Provenance.of(fromVector.contains(fused.chunkId()), fromLexical.contains(fused.chunkId()))))
                .toList();
        return new Retrieval(effectiveMode, candidates, vector.hits().size(), lexical.hits().size());
    }

    private Optional<List<RetrievedChunk>> rerank(String text, List<RetrievedChunk> ranked, int fetch, long deadline, List<String> warnings)
            throws RetrievalException {
        int depth = Math.min(ranked.size(), options.rerankDepth() > 0 ? options.rerankDepth() : fetch);
        List<RetrievedChunk> head = ranked.subList(0, depth);
        List<RerankCandidate> candidates = head.stream()
                .map(result -> new RerankCandidate(result.chunkId(), result.content()))
                .toList();

        Future<List<Long>> future = workers.submit(() -> reranker.rerank(text, candidates, depth));
        List<Long> order;
        try {
            order = await(future, deadline, "rerank");
        } catch (QueryTimeoutException e) {
            degrade(warnings, "Rerank exceeded the query deadline; returning pre-rerank order");
            return Optional.empty();
        } catch (ExecutionException e) {
            degrade(warnings, "Rerank failed (" + e.getCause() + "); returning pre-rerank order");
            return Optional.empty();
        }

        Map<Long, RetrievedChunk> byId = new LinkedHashMap<>();
        head.forEach(result -> byId.put(result.chunkId(), result));
        List<RetrievedChunk> reordered = new ArrayList<>(ranked.size());
        for (Long chunkId : order) {
            RetrievedChunk result = byId.remove(chunkId);
            if (result != null) {
                reordered.add(result);
            }
        }
        reordered.addAll(byId.values());
        reordered.addAll(ranked.subList(depth, ranked.size()));
        return Optional.of(reordered);
    }

    private List<RetrievedChunk> hydrate(List<Candidate> candidates) {
        Map<Long, ChunkRecord> chunks = store.chunks(candidates.stream().map(Candidate::chunkId).toList());
        Map<Long, DocumentRecord> documents = new LinkedHashMap<>();
        List<RetrievedChunk> hydrated = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            // Missing when the source was re-ingested between index lookup and hydration.
            ChunkRecord chunk = chunks.get(candidate.chunkId());
            if (chunk == null) {
                continue;
            }
            DocumentRecord document = documents.computeIfAbsent(chunk.documentId(),
                    id -> store.document(id).orElse(null));
            if (document == null) {
                continue;
            }
            hydrated.add(new RetrievedChunk(
                    chunk.id(),
                    document.id(),
                    document.sourceUri(),
                    document.title(),
                    chunk.ordinal(),
                    chunk.content(),
                    candidate.score(),
                    candidate.provenance()));
        }
        return hydrated;
    }

    private Future<List<ScoredChunk>> submitVector(String text, int fetch) {
        return workers.submit(() -> vectorIndex.query(embeddingService.embed(text), fetch));
    }

    private Future<List<ScoredChunk>> submitLexical(String text, int fetch) {
        return workers.submit(() -> lexicalIndex.query(text, fetch));
    }

    private static BranchOutcome outcome(Future<List<ScoredChunk>> branch, long deadline, String stage) throws RetrievalException {
        try {
            return new BranchOutcome(await(branch, deadline, stage), null);
        } catch (ExecutionException e) {
            return new BranchOutcome(List.of(), e.getCause());
        }
    }

    private static <T> T await(Future<T> future, long deadline, String stage) throws ExecutionException, RetrievalException {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new QueryTimeoutException(stage + " exceeded the query deadline");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RetrievalException("Interrupted while waiting for " + stage, e);
        }
    }

    private static void degrade(List<String> warnings, String warning) {
        warnings.add(warning);
        log.warn("query.degraded reason={}", warning);
    }

    private static String describe(SearchMode branch, Throwable cause) {
        if (cause instanceof EmbeddingException) {
            return "Query embedding failed: " + cause.getMessage();
        }
        if (cause instanceof IndexUnavailableException) {
            return cause.getMessage();
        }
        return branch.name().toLowerCase(Locale.ROOT) + " retrieval failed: " + cause;
    }

    static int fetchSize(int limit, int overfetchFactor) {
        return (int) Math.min(Integer.MAX_VALUE, (long) limit * overfetchFactor);
    }

    private static List<Long> ids(List<ScoredChunk> hits) {
        return hits.stream().map(ScoredChunk::chunkId).toList();
    }

    private record Candidate(long chunkId, double score, Provenance provenance) {
    }

    private record BranchOutcome(List<ScoredChunk> hits, Throwable failure) {
    }

    private record Retrieval(SearchMode effectiveMode, List<Candidate> candidates, int vectorHits, int lexicalHits) {
    }
}
