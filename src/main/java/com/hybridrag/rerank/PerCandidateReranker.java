package com.hybridrag.rerank;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores each candidate with its own judge call, at most {@code maxConcurrency} at a time. Once the
 * judge starts rate limiting, this reranker switches to one call at a time with backoff and stays
 * sequential for the rest of its life. A judge failure keeps the pre-rerank order.
 */
public class PerCandidateReranker implements Reranker, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PerCandidateReranker.class);
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(250);

    private final RelevanceJudge judge;
    private final ExecutorService pool;
    private final int maxAttempts;
    private final Duration backoff;
    private final AtomicBoolean sequential = new AtomicBoolean(false);

    public PerCandidateReranker(RelevanceJudge judge, int maxConcurrency) {
        this(judge, maxConcurrency, DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
    }

    public PerCandidateReranker(RelevanceJudge judge, int maxConcurrency, int maxAttempts, Duration backoff) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.judge = judge;
        this.pool = Executors.newFixedThreadPool(maxConcurrency);
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public List<Long> rerank(String query, List<RerankCandidate> candidates, int topN) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        try {
            double[] scores = sequential.get()
                    ? scoreSequentially(query, candidates)
                    : scoreConcurrently(query, candidates);
            return RankOrder.byScore(candidates, scores, topN);
        } catch (IOException e) {
            log.warn("Judge failed, keeping pre-rerank order: {}", e.getMessage());
            return Reranker.inputOrder(candidates, topN);
        }
    }

    public boolean sequential() {
        return sequential.get();
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private double[] scoreConcurrently(String query, List<RerankCandidate> candidates) throws IOException {
        List<Future<Double>> futures = new ArrayList<>(candidates.size());
        for (RerankCandidate candidate : candidates) {
            futures.add(pool.submit(() -> judge.score(query, candidate.content())));
        }

        double[] scores = new double[candidates.size()];
        List<Integer> rateLimited = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    scores[i] = futures.get(i).get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof JudgeRateLimitedException) {
                        rateLimited.add(i);
                    } else if (e.getCause() instanceof IOException ioException) {
                        throw ioException;
                    } else {
                        throw new IOException("Judge call failed", e.getCause());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for judge scores");
        } finally {
            futures.forEach(future -> future.cancel(true));
        }

        if (!rateLimited.isEmpty()) {
            if (sequential.compareAndSet(false, true)) {
                log.warn("Judge rate limited {} of {} calls; switching to sequential reranking",
                        rateLimited.size(),
                        candidates.size());
            }
            for (int i : rateLimited) {
                scores[i] = scoreWithBackoff(query, candidates.get(i));
            }
        }
        return scores;
    }

    private double[] scoreSequentially(String query, List<RerankCandidate> candidates) throws IOException {
        double[] scores = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            scores[i] = scoreWithBackoff(query, candidates.get(i));
        }
        return scores;
    }

    private double scoreWithBackoff(String query, RerankCandidate candidate) throws IOException {
        for (int attempt = 1; ; attempt++) {
            try {
                return judge.score(query, candidate.content());
            } catch (JudgeRateLimitedException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                pause(backoff.multipliedBy(attempt));
            }
        }
    }

    private static void pause(Duration duration) throws InterruptedIOException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during judge backoff");
        }
    }
}
