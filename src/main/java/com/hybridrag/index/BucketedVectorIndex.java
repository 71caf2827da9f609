package com.hybridrag.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory approximate nearest-neighbour index. Vectors are bucketed by a sign signature over their
 * first 16 dimensions; a query probes its own bucket plus three fixed neighbours and rescores the
 * candidates exactly. Small indexes, and probes that find too few candidates, fall back to a full
 * scan.
 *
 * <p>Bucketing is deferred: inserts land in a pending set that every query scans exactly, and
 * {@link #refresh()} folds them into the buckets. Nothing is randomized, so results depend only on
 * index state and the query vector.
 */
public class BucketedVectorIndex implements VectorIndex {
    private static final int DEFAULT_EXACT_SCAN_THRESHOLD = 150;
    private static final int SIGNATURE_BITS = 16;
    private static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparingLong(ScoredChunk::chunkId);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, float[]> vectors = new HashMap<>();
    private final Map<Integer, List<Long>> buckets = new HashMap<>();
    private final Set<Long> pending = new HashSet<>();
    private final int exactScanThreshold;
    private int dimension = -1;

    public BucketedVectorIndex() {
        this(DEFAULT_EXACT_SCAN_THRESHOLD);
    }

    public BucketedVectorIndex(int exactScanThreshold) {
        this.exactScanThreshold = exactScanThreshold;
    }

    @Override
    public void replace(Collection<Long> removed, Map<Long, float[]> added) {
        lock.writeLock().lock();
        try {
            int expected = dimension;
            for (float[] vector : added.values()) {
                if (expected == -1) {
                    expected = vector.length;
                } else if (vector.length != expected) {
                    throw new IllegalArgumentException("Vector dimension " + vector.length
                            + " does not match index generation dimension " + expected + "; rebuild the index");
                }
            }
            for (Long chunkId : removed) {
                vectors.remove(chunkId);
                pending.remove(chunkId);
            }
            added.forEach((chunkId, vector) -> {
                vectors.put(chunkId, vector);
                pending.add(chunkId);
            });
            dimension = vectors.isEmpty() ? -1 : expected;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredChunk> query(float[] vector, int k) {
        if (k <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            if (vectors.isEmpty()) {
                return List.of();
            }
            if (vector.length != dimension) {
                throw new IllegalArgumentException("Query dimension " + vector.length + " does not match index dimension " + dimension);
            }
            List<ScoredChunk> scored = new ArrayList<>();
            for (Long chunkId : candidateIds(vector, k)) {
                float[] candidate = vectors.get(chunkId);
                if (candidate != null) {
                    scored.add(new ScoredChunk(chunkId, cosine(vector, candidate)));
                }
            }
            scored.sort(RANKING);
            return scored.size() > k ? List.copyOf(scored.subList(0, k)) : scored;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void refresh() {
        lock.writeLock().lock();
        try {
            buckets.clear();
            for (Map.Entry<Long, float[]> entry : vectors.entrySet()) {
                buckets.computeIfAbsent(signature(entry.getValue()), unused -> new ArrayList<>()).add(entry.getKey());
            }
            pending.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            vectors.clear();
            buckets.clear();
            pending.clear();
            dimension = -1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Collection<Long> candidateIds(float[] vector, int k) {
        if (vectors.size() <= Math.max(exactScanThreshold, (long) k * 20)) {
            return vectors.keySet();
        }
        Set<Long> candidates = new HashSet<>(pending);
        int querySignature = signature(vector);
        for (int probe : List.of(querySignature, querySignature ^ 0x00FF, querySignature ^ 0xFF00, querySignature ^ 0x0F0F)) {
            candidates.addAll(buckets.getOrDefault(probe, List.of()));
        }
        if (candidates.size() < (long) k * 5) {
            return vectors.keySet();
        }
        return candidates;
    }

    private static int signature(float[] vector) {
        int signature = 0;
        for (int i = 0; i < Math.min(SIGNATURE_BITS, vector.length); i++) {
            if (vector[i] >= 0f) {
                signature |= (1 << i);
            }
        }
        return signature;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }
}
