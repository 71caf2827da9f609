package com.hybridrag.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hybridrag.ingest.ChunkingOptions;
import com.hybridrag.ingest.ChunkingStrategy;
import com.hybridrag.rerank.RerankStrategy;
import com.hybridrag.retrieval.RetrievalOptions;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final int MAX_EMBEDDING_BATCH = 100;

    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private RerankConfig rerank = new RerankConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private StorageConfig storage = new StorageConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public RerankConfig getRerank() {
        return rerank;
    }

    public void setRerank(RerankConfig rerank) {
        this.rerank = rerank == null ? new RerankConfig() : rerank;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public void validate() {
        chunkingOptions();
        retrievalOptions();
        if (embedding.getBatchSize() <= 0 || embedding.getBatchSize() > MAX_EMBEDDING_BATCH) {
            throw new IllegalArgumentException("embedding.batchSize must be between 1 and " + MAX_EMBEDDING_BATCH);
        }
        if (embedding.getDimension() <= 0) {
            throw new IllegalArgumentException("embedding.dimension must be positive");
        }
        if (retrieval.getWorkerThreads() < 2) {
            throw new IllegalArgumentException("retrieval.workerThreads must be at least 2 so both branches run concurrently");
        }
        if (rerank.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("rerank.maxConcurrency must be positive");
        }
        if (rerank.getStrategy() == null) {
            throw new IllegalArgumentException("rerank.strategy is required");
        }
        if (ingestion.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("ingestion.workerThreads must be positive");
        }
        if (ingestion.getExtensions() == null || ingestion.getExtensions().isEmpty()) {
            throw new IllegalArgumentException("ingestion.extensions must list at least one extension");
        }
        if (storage.getStatePath() == null || storage.getStatePath().isBlank()) {
            throw new IllegalArgumentException("storage.statePath is required");
        }
    }

    public ChunkingOptions chunkingOptions() {
        return new ChunkingOptions(
                chunking.getStrategy(),
                chunking.getMinTokens(),
                chunking.getMaxTokens(),
                chunking.getOverlapTokens());
    }

    public RetrievalOptions retrievalOptions() {
        return new RetrievalOptions(
                retrieval.getDefaultLimit(),
                retrieval.getOverfetchFactor(),
                retrieval.getRrfK(),
                retrieval.getVectorWeight(),
                retrieval.getLexicalWeight(),
                Duration.ofMillis(retrieval.getTimeoutMs()),
                rerank.isEnabled(),
                rerank.getDepth());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private ChunkingStrategy strategy = ChunkingStrategy.PARAGRAPH;
        private int minTokens = 25;
        private int maxTokens = 300;
        private int overlapTokens = 30;

        public ChunkingStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(ChunkingStrategy strategy) {
            this.strategy = strategy;
        }

        public int getMinTokens() {
            return minTokens;
        }

        public void setMinTokens(int minTokens) {
            this.minTokens = minTokens;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getOverlapTokens() {
            return overlapTokens;
        }

        public void setOverlapTokens(int overlapTokens) {
            this.overlapTokens = overlapTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int batchSize = 100;
        private int dimension = 384;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultLimit = 5;
        private int overfetchFactor = 2;
        private int rrfK = 60;
        private double vectorWeight = 1.0;
        private double lexicalWeight = 1.0;
        private int timeoutMs = 10000;
        private int workerThreads = 4;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getOverfetchFactor() {
            return overfetchFactor;
        }

        public void setOverfetchFactor(int overfetchFactor) {
            this.overfetchFactor = overfetchFactor;
        }

        public int getRrfK() {
            return rrfK;
        }

        public void setRrfK(int rrfK) {
            this.rrfK = rrfK;
        }

        public double getVectorWeight() {
            return vectorWeight;
        }

        public void setVectorWeight(double vectorWeight) {
            this.vectorWeight = vectorWeight;
        }

        public double getLexicalWeight() {
            return lexicalWeight;
        }

        public void setLexicalWeight(double lexicalWeight) {
            this.lexicalWeight = lexicalWeight;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankConfig {
        private boolean enabled = false;
        private RerankStrategy strategy = RerankStrategy.PER_CANDIDATE;
        private int depth = 0;
        private int maxConcurrency = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public RerankStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RerankStrategy strategy) {
            this.strategy = strategy;
        }

        public int getDepth() {
            return depth;
        }

        public void setDepth(int depth) {
            this.depth = depth;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int workerThreads = 2;
        private List<String> extensions = new ArrayList<>(List.of(".md", ".markdown", ".txt"));

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String statePath = ".hybridrag/store.json";

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }
    }
}
