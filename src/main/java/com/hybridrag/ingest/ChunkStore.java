package com.hybridrag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * The Document and Chunk tables. Reads run concurrently; every mutation takes the write lock, so a
 * document's chunk set is swapped in one step and readers never observe a half-replaced document.
 * The whole store is persisted as a JSON snapshot.
 */
public class ChunkStore {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, DocumentRecord> documents = new TreeMap<>();
    private final Map<String, Long> documentIdsBySource = new HashMap<>();
    private final Map<Long, ChunkRecord> chunks = new TreeMap<>();
    private final Map<Long, List<Long>> chunkIdsByDocument = new HashMap<>();
    private final Clock clock;

    private long nextDocumentId = 1;
    private long nextChunkId = 1;
    private String embeddingVersion;

    public ChunkStore() {
        this(Clock.systemUTC());
    }

    public ChunkStore(Clock clock) {
        this.clock = clock;
    }

    public ReplaceResult replaceDocument(
            String sourceUri,
            String title,
            ChunkingStrategy strategy,
            List<ChunkDraft> drafts,
            List<float[]> embeddings,
            String version) {
        if (drafts.size() != embeddings.size()) {
            throw new IllegalArgumentException("Expected one embedding per chunk");
        }
        lock.writeLock().lock();
        try {
            if (embeddingVersion != null && !embeddingVersion.equals(version) && !chunks.isEmpty()) {
                throw new IllegalStateException("Store holds vectors from " + embeddingVersion + ", refusing " + version);
            }
            Long existingId = documentIdsBySource.get(sourceUri);
            DocumentRecord previous = existingId == null ? null : documents.get(existingId);
            DocumentRecord document = previous == null
                    ? new DocumentRecord(nextDocumentId++, sourceUri, title, strategy, clock.instant())
                    : new DocumentRecord(previous.id(), sourceUri, title, strategy, previous.createdAt());
            documents.put(document.id(), document);
            documentIdsBySource.put(sourceUri, document.id());

            List<ChunkRecord> removed = removeChunksOf(document.id());
            List<ChunkRecord> inserted = new ArrayList<>(drafts.size());
            for (int i = 0; i < drafts.size(); i++) {
                ChunkDraft draft = drafts.get(i);
                ChunkRecord chunk = new ChunkRecord(
                        nextChunkId++,
                        document.id(),
                        draft.content(),
                        draft.ordinal(),
                        draft.tokenCount(),
                        embeddings.get(i));
                chunks.put(chunk.id(), chunk);
                inserted.add(chunk);
            }
            chunkIdsByDocument.put(document.id(), inserted.stream().map(ChunkRecord::id).toList());
            embeddingVersion = version;
            return new ReplaceResult(document, previous, removed, inserted);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void restore(ReplaceResult result) {
        lock.writeLock().lock();
        try {
            long documentId = result.document().id();
            removeChunksOf(documentId);
            if (result.created()) {
                documents.remove(documentId);
                documentIdsBySource.remove(result.document().sourceUri());
                return;
            }
            documents.put(documentId, result.previous());
            for (ChunkRecord chunk : result.removed()) {
                chunks.put(chunk.id(), chunk);
            }
            chunkIdsByDocument.put(documentId, result.removed().stream().map(ChunkRecord::id).toList());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<List<ChunkRecord>> purge(String sourceUri) {
        lock.writeLock().lock();
        try {
            Long documentId = documentIdsBySource.remove(sourceUri);
            if (documentId == null) {
                return Optional.empty();
            }
            documents.remove(documentId);
            return Optional.of(removeChunksOf(documentId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void purgeAll() {
        lock.writeLock().lock();
        try {
            documents.clear();
            documentIdsBySource.clear();
            chunks.clear();
            chunkIdsByDocument.clear();
            embeddingVersion = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearChunks() {
        lock.writeLock().lock();
        try {
            chunks.clear();
            chunkIdsByDocument.clear();
            embeddingVersion = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<DocumentRecord> findDocument(String sourceUri) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documentIdsBySource.get(sourceUri)).map(documents::get);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DocumentRecord> document(long documentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documents.get(documentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ChunkRecord> chunk(long chunkId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(chunks.get(chunkId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<Long, ChunkRecord> chunks(Collection<Long> chunkIds) {
        lock.readLock().lock();
        try {
            Map<Long, ChunkRecord> found = new HashMap<>();
            for (Long chunkId : chunkIds) {
                ChunkRecord chunk = chunks.get(chunkId);
                if (chunk != null) {
                    found.put(chunkId, chunk);
                }
            }
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ChunkRecord> chunksOf(long documentId) {
        lock.readLock().lock();
        try {
            return chunkIdsByDocument.getOrDefault(documentId, List.of()).stream()
                    .map(chunks::get)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DocumentRecord> documents() {
        lock.readLock().lock();
        try {
            return List.copyOf(documents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ChunkRecord> allChunks() {
        lock.readLock().lock();
        try {
            return List.copyOf(chunks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public String embeddingVersion() {
        lock.readLock().lock();
        try {
            return embeddingVersion;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean requiresReembedding(String version) {
        lock.readLock().lock();
        try {
            return !chunks.isEmpty() && embeddingVersion != null && !embeddingVersion.equals(version);
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreStats stats() {
        lock.readLock().lock();
        try {
            return new StoreStats(documents.size(), chunks.size(), embeddingVersion);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void save(Path path) throws IOException {
        Snapshot snapshot;
        lock.readLock().lock();
        try {
            snapshot = new Snapshot(
                    nextDocumentId,
                    nextChunkId,
                    embeddingVersion,
                    List.copyOf(documents.values()),
                    List.copyOf(chunks.values()));
        } finally {
            lock.readLock().unlock();
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    }

    public static ChunkStore load(Path path) throws IOException {
        ChunkStore store = new ChunkStore();
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return store;
        }
        Snapshot snapshot = mapper().readValue(path.toFile(), Snapshot.class);
        store.nextDocumentId = snapshot.nextDocumentId();
        store.nextChunkId = snapshot.nextChunkId();
        store.embeddingVersion = snapshot.embeddingVersion();
        for (DocumentRecord document : snapshot.documents()) {
            store.documents.put(document.id(), document);
            store.documentIdsBySource.put(document.sourceUri(), document.id());
        }
        Map<Long, List<ChunkRecord>> byDocument = new HashMap<>();
        for (ChunkRecord chunk : snapshot.chunks()) {
            store.chunks.put(chunk.id(), chunk);
            byDocument.computeIfAbsent(chunk.documentId(), unused -> new ArrayList<>()).add(chunk);
        }
        byDocument.forEach((documentId, owned) -> store.chunkIdsByDocument.put(documentId, owned.stream()
                .sorted((a, b) -> Integer.compare(a.ordinal(), b.ordinal()))
                .map(ChunkRecord::id)
                .toList()));
        return store;
    }

    private List<ChunkRecord> removeChunksOf(long documentId) {
        List<Long> ids = chunkIdsByDocument.remove(documentId);
        if (ids == null) {
            return List.of();
        }
        List<ChunkRecord> removed = new ArrayList<>(ids.size());
        for (Long id : ids) {
            ChunkRecord chunk = chunks.remove(id);
            if (chunk != null) {
                removed.add(chunk);
            }
        }
        return removed;
    }

    private static ObjectMapper mapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    public record ReplaceResult(DocumentRecord document, DocumentRecord previous, List<ChunkRecord> removed, List<ChunkRecord> inserted) {
        public boolean created() {
            return previous == null;
        }
    }

    public record Snapshot(
            long nextDocumentId,
            long nextChunkId,
            String embeddingVersion,
            List<DocumentRecord> documents,
            List<ChunkRecord> chunks) {
    }
}
