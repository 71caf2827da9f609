package com.hybridrag.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.index.BucketedVectorIndex;
import com.hybridrag.index.IndexUnavailableException;
import com.hybridrag.index.LuceneLexicalIndex;
import com.hybridrag.index.VectorIndex;
import com.hybridrag.ingest.BatchIngestionSummary;
import com.hybridrag.ingest.ChunkRecord;
import com.hybridrag.ingest.ChunkStore;
import com.hybridrag.ingest.ChunkingStrategy;
import com.hybridrag.ingest.EmbeddingService;
import com.hybridrag.ingest.EmbeddingServices;
import com.hybridrag.ingest.FileDocumentParser;
import com.hybridrag.ingest.IngestException;
import com.hybridrag.ingest.IngestionReport;
import com.hybridrag.ingest.IngestionService;
import com.hybridrag.ingest.StoreStats;
import com.hybridrag.rerank.Reranker;
import com.hybridrag.rerank.RerankerFactory;
import com.hybridrag.retrieval.QueryRequest;
import com.hybridrag.retrieval.QueryResponse;
import com.hybridrag.retrieval.QueryService;
import com.hybridrag.retrieval.RetrievalException;

import okhttp3.OkHttpClient;

/**
 * Wires the store, both indexes, the ingestion pipeline and the query pipeline from one validated
 * {@link AppConfig}. The store is reloaded from its snapshot on open and the in-memory indexes are
 * rebuilt from it; every mutation writes a fresh snapshot.
 */
public class HybridRetrievalEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalEngine.class);

    private final ChunkStore store;
    private final Path statePath;
    private final VectorIndex vectorIndex;
    private final LuceneLexicalIndex lexicalIndex;
    private final Reranker reranker;
    private final ExecutorService queryWorkers;
    private final ExecutorService ingestWorkers;
    private final IngestionService ingestionService;
    private final QueryService queryService;
    private final Object persistMonitor = new Object();

    public HybridRetrievalEngine(
            AppConfig config,
            ChunkStore store,
            Path statePath,
            EmbeddingService embeddingService,
            Reranker reranker) throws IOException {
        config.validate();
        this.store = store;
        this.statePath = statePath;
        this.vectorIndex = new BucketedVectorIndex();
        this.lexicalIndex = new LuceneLexicalIndex();
        this.reranker = reranker;
        this.queryWorkers = Executors.newFixedThreadPool(config.getRetrieval().getWorkerThreads());
        this.ingestWorkers = Executors.newFixedThreadPool(config.getIngestion().getWorkerThreads());
        this.ingestionService = new IngestionService(
                store,
                vectorIndex,
                lexicalIndex,
                new FileDocumentParser(config.getIngestion().getExtensions()),
                embeddingService,
                config.chunkingOptions(),
                config.getEmbedding().getBatchSize(),
                ingestWorkers);
        this.queryService = new QueryService(
                store,
                vectorIndex,
                lexicalIndex,
                embeddingService,
                reranker,
                config.retrievalOptions(),
                queryWorkers);
        loadIndexes(embeddingService);
    }

    public static HybridRetrievalEngine open(AppConfig config) throws IOException {
        config.validate();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getRetrieval().getTimeoutMs()))
                .build();
        Path statePath = Path.of(config.getStorage().getStatePath());
        return new HybridRetrievalEngine(
                config,
                ChunkStore.load(statePath),
                statePath,
                EmbeddingServices.fromEnvironment(httpClient, config.getEmbedding().getDimension()),
                RerankerFactory.fromEnvironment(httpClient, config.getRerank().getStrategy(), config.getRerank().getMaxConcurrency()));
    }

    public IngestionReport ingest(String sourceUri) throws IngestException, IOException {
        IngestionReport report = ingestionService.ingest(sourceUri);
        persist();
        return report;
    }

    public IngestionReport ingest(String sourceUri, ChunkingStrategy strategy) throws IngestException, IOException {
        IngestionReport report = ingestionService.ingest(sourceUri, strategy);
        persist();
        return report;
    }

    public BatchIngestionSummary ingestAll(Collection<String> sourceUris, ChunkingStrategy strategy) throws IOException {
        BatchIngestionSummary summary = ingestionService.ingestAll(sourceUris, strategy);
        persist();
        return summary;
    }

    public BatchIngestionSummary ingestDirectory(Path directory) throws IOException {
        BatchIngestionSummary summary = ingestionService.ingestDirectory(directory);
        persist();
        return summary;
    }

    public boolean purge(String sourceUri) throws IngestException, IOException {
        boolean purged = ingestionService.purge(sourceUri);
        if (purged) {
            persist();
        }
        return purged;
    }

    public void purgeAll() throws IndexUnavailableException, IOException {
        ingestionService.purgeAll();
        persist();
    }

    public BatchIngestionSummary rebuild() throws IndexUnavailableException, IOException {
        BatchIngestionSummary summary = ingestionService.rebuild();
        persist();
        return summary;
    }

    public QueryResponse query(QueryRequest request) throws RetrievalException {
        return queryService.query(request);
    }

    public StoreStats stats() {
        return store.stats();
    }

    @Override
    public void close() throws IOException {
        queryWorkers.shutdownNow();
        ingestWorkers.shutdownNow();
        try {
            if (!queryWorkers.awaitTermination(5, TimeUnit.SECONDS) || !ingestWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pools did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (reranker instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Unable to close reranker: {}", e.getMessage());
            }
        }
        lexicalIndex.close();
    }

    private void loadIndexes(EmbeddingService embeddingService) throws IOException {
        boolean loadVectors = !store.requiresReembedding(embeddingService.version());
        if (!loadVectors) {
            log.warn("Stored vectors come from {} but the embedder is {}; vector search is empty until a rebuild",
                    store.embeddingVersion(),
                    embeddingService.version());
        }
        Map<Long, float[]> vectors = new LinkedHashMap<>();
        Map<Long, String> contents = new LinkedHashMap<>();
        for (ChunkRecord chunk : store.allChunks()) {
            if (loadVectors && chunk.embedding() != null) {
                vectors.put(chunk.id(), chunk.embedding());
            }
            contents.put(chunk.id(), chunk.content());
        }
        try {
            vectorIndex.replace(List.of(), vectors);
            vectorIndex.refresh();
            lexicalIndex.replace(List.of(), contents);
        } catch (IndexUnavailableException e) {
            throw new IOException("Unable to rebuild indexes from " + statePath, e);
        }
        StoreStats stats = store.stats();
        log.info("Engine ready documents={} chunks={} embeddingVersion={} statePath={}",
                stats.documents(),
                stats.chunks(),
                stats.embeddingVersion(),
                statePath);
    }

    private void persist() throws IOException {
        if (statePath == null) {
            return;
        }
        synchronized (persistMonitor) {
            store.save(statePath);
        }
    }
}
