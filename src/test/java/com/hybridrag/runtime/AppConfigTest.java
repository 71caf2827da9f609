package com.hybridrag.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hybridrag.ingest.ChunkingStrategy;
import com.hybridrag.rerank.RerankStrategy;
import com.hybridrag.retrieval.RetrievalOptions;

class AppConfigTest {

    @Test
    void shouldDefaultToParagraphChunkingAndEqualWeightHybrid() {
        AppConfig config = new AppConfig();
        config.validate();

        assertEquals(ChunkingStrategy.PARAGRAPH, config.chunkingOptions().strategy());
        assertEquals(300, config.chunkingOptions().maxTokens());
        RetrievalOptions retrieval = config.retrievalOptions();
        assertEquals(5, retrieval.defaultLimit());
        assertEquals(60, retrieval.rrfK());
        assertEquals(retrieval.vectorWeight(), retrieval.lexicalWeight());
        assertEquals(Duration.ofSeconds(10), retrieval.timeout());
        assertFalse(retrieval.rerankByDefault());
        assertEquals(List.of(".md", ".markdown", ".txt"), config.getIngestion().getExtensions());
    }

    @Test
    void shouldBindYamlAndKeepDefaultsForMissingSections() throws Exception {
        String yaml = """
                chunking:
                  strategy: FIXED_WINDOW
                  maxTokens: 120
                retrieval:
                  lexicalWeight: 2.5
                  timeoutMs: 1500
                rerank:
                  enabled: true
                  strategy: BATCHED
                storage:
                  statePath: /tmp/store.json
                unknownSection:
                  ignored: true
                """;

        AppConfig config = new ObjectMapper(new YAMLFactory()).readValue(yaml, AppConfig.class);
        config.validate();

        assertEquals(ChunkingStrategy.FIXED_WINDOW, config.getChunking().getStrategy());
        assertEquals(120, config.getChunking().getMaxTokens());
        assertEquals(25, config.getChunking().getMinTokens());
        assertEquals(2.5, config.retrievalOptions().lexicalWeight());
        assertEquals(Duration.ofMillis(1500), config.retrievalOptions().timeout());
        assertTrue(config.retrievalOptions().rerankByDefault());
        assertEquals(RerankStrategy.BATCHED, config.getRerank().getStrategy());
        assertEquals(100, config.getEmbedding().getBatchSize());
        assertEquals("/tmp/store.json", config.getStorage().getStatePath());
    }

    @Test
    void shouldRejectInconsistentSettings() {
        assertInvalid(config -> {
            config.getChunking().setMinTokens(400);
            config.getChunking().setMaxTokens(300);
        });
        assertInvalid(config -> config.getChunking().setOverlapTokens(300));
        assertInvalid(config -> config.getRetrieval().setOverfetchFactor(0));
        assertInvalid(config -> config.getRetrieval().setVectorWeight(-1));
        assertInvalid(config -> config.getRetrieval().setWorkerThreads(1));
        assertInvalid(config -> config.getEmbedding().setBatchSize(0));
        assertInvalid(config -> config.getEmbedding().setBatchSize(101));
        assertInvalid(config -> config.getStorage().setStatePath(" "));
    }

    private static void assertInvalid(Consumer<AppConfig> change) {
        AppConfig config = new AppConfig();
        change.accept(config);
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}
