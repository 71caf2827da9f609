package com.hybridrag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.index.IndexUnavailableException;
import com.hybridrag.index.LexicalIndex;
import com.hybridrag.index.VectorIndex;

/**
 * Parser, chunker and embedder feeding the store and both indexes.
 *
 * <p>Every source is handled as a replace: all work that can fail (parsing, chunking, embedding)
 * happens before anything is written, then the old chunk set is swapped for the new one. A failed
 * index update rolls the store back, so a source is either fully re-ingested or left untouched.
 * Different sources ingest in parallel; a second concurrent ingest of the same source is rejected.
 *
 * <p>The store swap and the two index updates are not one atomic step. A query that runs between
 * them can get index hits for chunk ids the store no longer holds; those are dropped during
 * hydration, so the source may be missing from that one response but stale chunks are never
 * returned.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ChunkStore store;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final DocumentParser parser;
    private final EmbeddingService embeddingService;
    private final ChunkingOptions chunking;
    private final int embeddingBatchSize;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public IngestionService(
            ChunkStore store,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            DocumentParser parser,
            EmbeddingService embeddingService,
            ChunkingOptions chunking,
            int embeddingBatchSize,
            ExecutorService workers) {
        if (embeddingBatchSize <= 0) {
            throw new IllegalArgumentException("embeddingBatchSize must be positive");
        }
        this.store = store;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.parser = parser;
        this.embeddingService = embeddingService;
        this.chunking = chunking;
        this.embeddingBatchSize = embeddingBatchSize;
        this.workers = workers;
    }

    public IngestionReport ingest(String sourceUri) throws IngestException {
        return ingest(sourceUri, chunking.strategy());
    }

    public IngestionReport ingest(String sourceUri, ChunkingStrategy strategy) throws IngestException {
        if (!inFlight.add(sourceUri)) {
            throw new IngestException(sourceUri, IngestException.Kind.CONCURRENT_INGESTION,
                    "Source is already being ingested: " + sourceUri, null);
        }
        try {
            return ingestExclusive(sourceUri, chunking.withStrategy(strategy));
        } finally {
            inFlight.remove(sourceUri);
        }
    }

    public BatchIngestionSummary ingestAll(Collection<String> sourceUris, ChunkingStrategy strategy) {
        Map<String, ChunkingStrategy> strategies = new LinkedHashMap<>();
        sourceUris.forEach(sourceUri -> strategies.putIfAbsent(sourceUri, strategy));
        return ingestEach(strategies);
    }

    private BatchIngestionSummary ingestEach(Map<String, ChunkingStrategy> strategies) {
        Map<String, Future<IngestionReport>> futures = new LinkedHashMap<>();
        strategies.forEach((sourceUri, strategy) -> futures.put(sourceUri, workers.submit(() -> ingest(sourceUri, strategy))));

        List<IngestionReport> reports = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<String, Future<IngestionReport>> entry : futures.entrySet()) {
            String sourceUri = entry.getKey();
            if (interrupted) {
                entry.getValue().cancel(true);
                failures.put(sourceUri, "interrupted");
                continue;
            }
            try {
                reports.add(entry.getValue().get());
            } catch (ExecutionException e) {
                failures.put(sourceUri, describe(sourceUri, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                entry.getValue().cancel(true);
                failures.put(sourceUri, "interrupted");
            }
        }

        vectorIndex.refresh();
        BatchIngestionSummary summary = BatchIngestionSummary.of(reports, failures);
        log.info("Ingestion batch complete succeeded={} failed={} chunks={}",
                summary.succeeded(),
                summary.failed(),
                summary.chunks());
        return summary;
    }

    public BatchIngestionSummary ingestDirectory(Path directory) throws IOException {
        List<String> sources;
        try (Stream<Path> paths = Files.walk(directory)) {
            sources = paths
                    .filter(Files::isRegularFile)
                    .filter(parser::supports)
                    .map(path -> path.toAbsolutePath().normalize().toString())
                    .sorted()
                    .toList();
        }
        log.info("Found {} documents under {}", sources.size(), directory);
        return ingestAll(sources, chunking.strategy());
    }

    public boolean purge(String sourceUri) throws IngestException {
        if (!inFlight.add(sourceUri)) {
            throw new IngestException(sourceUri, IngestException.Kind.CONCURRENT_INGESTION,
                    "Source is being ingested, refusing purge: " + sourceUri, null);
        }
        try {
            List<ChunkRecord> removed = store.purge(sourceUri).orElse(null);
            if (removed == null) {
                return false;
            }
            applyToIndexes(removed, List.of());
            log.info("Purged source={} chunks={}", sourceUri, removed.size());
            return true;
        } catch (IndexUnavailableException e) {
            throw new IngestException(sourceUri, IngestException.Kind.INDEX, e.getMessage(), e);
        } finally {
            inFlight.remove(sourceUri);
        }
    }

    public void purgeAll() throws IndexUnavailableException {
        store.purgeAll();
        vectorIndex.clear();
        lexicalIndex.clear();
        log.info("Purged all documents");
    }

    /**
     * Starts a new vector generation and re-ingests every known source with the current embedder,
     * each with the chunking strategy it was last ingested with. Document ids survive the rebuild.
     */
    public BatchIngestionSummary rebuild() throws IndexUnavailableException {
        Map<String, ChunkingStrategy> sources = new LinkedHashMap<>();
        for (DocumentRecord document : store.documents()) {
            sources.put(document.sourceUri(), document.strategy() == null ? chunking.strategy() : document.strategy());
        }
        log.info("Rebuilding indexes for {} sources with embedding version {}", sources.size(), embeddingService.version());
        store.clearChunks();
        vectorIndex.clear();
        lexicalIndex.clear();
        return ingestEach(sources);
    }

    private IngestionReport ingestExclusive(String sourceUri, ChunkingOptions options) throws IngestException {
        if (store.requiresReembedding(embeddingService.version())) {
            throw new IngestException(sourceUri, IngestException.Kind.MODEL_MISMATCH,
                    "Store holds vectors from " + store.embeddingVersion() + " but the embedder is "
                            + embeddingService.version() + "; run a rebuild",
                    null);
        }

        ParsedDocument parsed;
        try {
            parsed = parser.parse(sourceUri);
        } catch (ParseException e) {
            throw new IngestException(sourceUri, IngestException.Kind.PARSE, e.getMessage(), e);
        }

        List<ChunkDraft> drafts = options.strategy()
                .newChunker(options.overlapTokens())
                .chunk(parsed.text(), options.minTokens(), options.maxTokens());
        List<float[]> embeddings = embedAll(sourceUri, drafts);

        ChunkStore.ReplaceResult result;
        try {
            result = store.replaceDocument(sourceUri, parsed.title(), options.strategy(), drafts, embeddings, embeddingService.version());
        } catch (IllegalStateException e) {
            throw new IngestException(sourceUri, IngestException.Kind.MODEL_MISMATCH, e.getMessage(), e);
        }

        try {
            applyToIndexes(result.removed(), result.inserted());
        } catch (IndexUnavailableException | RuntimeException e) {
            store.restore(result);
            revertIndexes(result);
            throw new IngestException(sourceUri, IngestException.Kind.INDEX, "Index update failed: " + e.getMessage(), e);
        }

        log.info("Ingested source={} documentId={} chunks={} replaced={} strategy={}",
                sourceUri,
                result.document().id(),
                result.inserted().size(),
                result.removed().size(),
                options.strategy());
        return new IngestionReport(sourceUri, result.document().id(), result.inserted().size(), result.removed().size());
    }

    private List<float[]> embedAll(String sourceUri, List<ChunkDraft> drafts) throws IngestException {
        List<float[]> embeddings = new ArrayList<>(drafts.size());
        for (int start = 0; start < drafts.size(); start += embeddingBatchSize) {
            List<String> batch = drafts.subList(start, Math.min(drafts.size(), start + embeddingBatchSize)).stream()
                    .map(ChunkDraft::content)
                    .toList();
            try {
                List<float[]> vectors = embeddingService.embed(batch);
                if (vectors.size() != batch.size()) {
                    throw new EmbeddingException("Expected " + batch.size() + " vectors but received " + vectors.size(), batch);
                }
                embeddings.addAll(vectors);
            } catch (EmbeddingException e) {
                throw new IngestException(sourceUri, IngestException.Kind.EMBEDDING,
                        "Embedding failed for batch of " + e.batch().size() + " chunks: " + e.getMessage(), e);
            }
        }
        return embeddings;
    }

    private void applyToIndexes(List<ChunkRecord> removed, List<ChunkRecord> inserted) throws IndexUnavailableException {
        List<Long> removedIds = removed.stream().map(ChunkRecord::id).toList();
        Map<Long, float[]> vectors = new LinkedHashMap<>();
        Map<Long, String> contents = new LinkedHashMap<>();
        for (ChunkRecord chunk : inserted) {
            if (chunk.embedding() != null) {
                vectors.put(chunk.id(), chunk.embedding());
            }
            contents.put(chunk.id(), chunk.content());
        }
        vectorIndex.replace(removedIds, vectors);
        lexicalIndex.replace(removedIds, contents);
    }

    private void revertIndexes(ChunkStore.ReplaceResult result) {
        try {
            applyToIndexes(result.inserted(), result.removed());
        } catch (IndexUnavailableException | RuntimeException e) {
            log.error("Unable to revert indexes for source={}; run a rebuild to resynchronize", result.document().sourceUri(), e);
        }
    }

    private static String describe(String sourceUri, Throwable cause) {
        if (cause instanceof IngestException ingestException) {
            if (ingestException.kind() == IngestException.Kind.PARSE) {
                log.warn("Skipping source={} reason={}", sourceUri, ingestException.getMessage());
            } else {
                log.error("Aborted source={} kind={} reason={}", sourceUri, ingestException.kind(), ingestException.getMessage());
            }
            return ingestException.kind() + ": " + ingestException.getMessage();
        }
        log.error("Unexpected failure ingesting source={}", sourceUri, cause);
        return "UNEXPECTED: " + cause;
    }
}
