package com.hybridrag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hybridrag.ingest.BatchIngestionSummary;
import com.hybridrag.ingest.ChunkingStrategy;
import com.hybridrag.ingest.IngestException;
import com.hybridrag.ingest.IngestionReport;
import com.hybridrag.ingest.StoreStats;
import com.hybridrag.retrieval.QueryRequest;
import com.hybridrag.retrieval.QueryResponse;
import com.hybridrag.retrieval.RetrievalException;
import com.hybridrag.retrieval.RetrievedChunk;
import com.hybridrag.retrieval.SearchMode;
import com.hybridrag.runtime.AppConfig;
import com.hybridrag.runtime.HybridRetrievalEngine;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "hybrid-rag",
        mixinStandardHelpOptions = true,
        version = "hybrid-rag 0.1.0",
        description = "Ingest documents and run vector, keyword or hybrid retrieval over them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int SNIPPET_LENGTH = 200;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--state-path", description = "Overrides storage.statePath from the config")
    Path statePath;

    @Option(names = "--source", description = "Source path or file: URI to ingest or purge (repeatable)")
    List<String> sources;

    @Option(names = "--dir", description = "Directory to ingest recursively")
    Path directory;

    @Option(names = "--strategy", description = "Chunking strategy: ${COMPLETION-CANDIDATES}")
    ChunkingStrategy strategy;

    @Option(names = "--all", description = "Purge every document", defaultValue = "false")
    boolean all;

    @Option(names = "--query", description = "Query text used in query mode")
    String query;

    @Option(names = "--limit", description = "Results to return")
    Integer limit;

    @Option(names = "--search-mode", description = "vector, keyword or hybrid", defaultValue = "hybrid")
    String searchMode;

    @Option(names = "--diversity-cap", description = "Maximum results per document")
    Integer diversityCap;

    @Option(names = "--rerank", description = "Rerank fused candidates with the relevance judge")
    Boolean rerank;

    @Option(names = "--timeout-ms", description = "Query deadline in milliseconds")
    Integer timeoutMs;

    enum Mode {
        ingest,
        query,
        purge,
        stats,
        rebuild
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (statePath != null) {
            config.getStorage().setStatePath(statePath.toString());
        }
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }

        QueryRequest request = null;
        if (mode == Mode.query) {
            if (query == null || query.isBlank()) {
                log.error("--query is required in query mode");
                return 2;
            }
            try {
                request = new QueryRequest(
                        query,
                        limit,
                        SearchMode.fromString(searchMode),
                        diversityCap,
                        timeoutMs == null ? null : Duration.ofMillis(timeoutMs),
                        rerank);
            } catch (IllegalArgumentException e) {
                log.error("Invalid query options: {}", e.getMessage());
                return 2;
            }
        }
        if (mode == Mode.ingest && (sources == null || sources.isEmpty()) && directory == null) {
            log.error("--source or --dir is required in ingest mode");
            return 2;
        }
        if (mode == Mode.purge && !all && (sources == null || sources.isEmpty())) {
            log.error("--source or --all is required in purge mode");
            return 2;
        }

        try (HybridRetrievalEngine engine = HybridRetrievalEngine.open(config)) {
            return switch (mode) {
                case ingest -> runIngest(engine, config);
                case query -> runQuery(engine, request);
                case purge -> runPurge(engine);
                case stats -> printStats(engine.stats());
                case rebuild -> printSummary(engine.rebuild());
            };
        }
    }

    private int runIngest(HybridRetrievalEngine engine, AppConfig config) throws IOException {
        ChunkingStrategy chosen = strategy == null ? config.getChunking().getStrategy() : strategy;
        int exitCode = 0;
        if (sources != null && !sources.isEmpty()) {
            if (sources.size() == 1) {
                try {
                    IngestionReport report = engine.ingest(sources.get(0), chosen);
                    System.out.printf("Ingested %s: %d chunks (%d replaced)%n",
                            report.sourceUri(),
                            report.chunksCreated(),
                            report.chunksReplaced());
                } catch (IngestException e) {
                    log.error("Ingestion failed source={} kind={} reason={}", e.sourceUri(), e.kind(), e.getMessage());
                    exitCode = 1;
                }
            } else {
                exitCode = Math.max(exitCode, printSummary(engine.ingestAll(sources, chosen)));
            }
        }
        if (directory != null) {
            if (!Files.isDirectory(directory)) {
                log.error("Directory not found: {}", directory);
                return 2;
            }
            exitCode = Math.max(exitCode, printSummary(engine.ingestDirectory(directory)));
        }
        return exitCode;
    }

    private int runQuery(HybridRetrievalEngine engine, QueryRequest request) {
        QueryResponse response;
        try {
            response = engine.query(request);
        } catch (RetrievalException e) {
            log.error("Query failed: {}", e.getMessage());
            return 1;
        }
        response.warnings().forEach(warning -> System.out.println("warning: " + warning));
        if (response.results().isEmpty()) {
            System.out.println("No results.");
            return 0;
        }
        List<RetrievedChunk> results = response.results();
        for (int i = 0; i < results.size(); i++) {
            RetrievedChunk result = results.get(i);
            System.out.printf("[%d] %s (chunk %d) score=%.4f %s%n",
                    i + 1,
                    result.source(),
                    result.ordinal(),
                    result.score(),
                    result.provenance());
            System.out.println("    " + snippet(result.content()));
        }
        return 0;
    }

    private int runPurge(HybridRetrievalEngine engine) throws Exception {
        if (all) {
            engine.purgeAll();
            System.out.println("Purged all documents.");
            return 0;
        }
        int exitCode = 0;
        for (String source : sources) {
            try {
                System.out.println((engine.purge(source) ? "Purged " : "Not found: ") + source);
            } catch (IngestException e) {
                log.error("Purge failed source={} reason={}", source, e.getMessage());
                exitCode = 1;
            }
        }
        return exitCode;
    }

    private int printStats(StoreStats stats) {
        System.out.printf("documents=%d chunks=%d embeddingVersion=%s%n",
                stats.documents(),
                stats.chunks(),
                stats.embeddingVersion() == null ? "-" : stats.embeddingVersion());
        return 0;
    }

    private int printSummary(BatchIngestionSummary summary) {
        System.out.printf("succeeded=%d failed=%d chunks=%d%n", summary.succeeded(), summary.failed(), summary.chunks());
        for (Map.Entry<String, String> failure : summary.failures().entrySet()) {
            System.out.printf("  failed %s: %s%n", failure.getKey(), failure.getValue());
        }
        return summary.failed() == 0 ? 0 : 1;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private static String snippet(String content) {
        String flattened = content.strip().replaceAll("\\s+", " ");
        return flattened.length() > SNIPPET_LENGTH ? flattened.substring(0, SNIPPET_LENGTH) + "..." : flattened;
    }
}
