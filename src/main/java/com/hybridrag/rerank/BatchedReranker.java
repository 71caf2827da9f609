package com.hybridrag.rerank;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class BatchedReranker implements Reranker {
    private static final Logger log = LoggerFactory.getLogger(BatchedReranker.class);

    private final BatchRelevanceJudge judge;
    private final ObjectMapper mapper = new ObjectMapper();

    public BatchedReranker(BatchRelevanceJudge judge) {
        this.judge = judge;
    }

    @Override
    public List<Long> rerank(String query, List<RerankCandidate> candidates, int topN) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        String reply;
        try {
            reply = judge.judge(query, candidates.stream().map(RerankCandidate::content).toList());
        } catch (IOException e) {
            log.warn("Batch judge call failed, keeping pre-rerank order: {}", e.getMessage());
            return Reranker.inputOrder(candidates, topN);
        }
        try {
            return RankOrder.byScore(candidates, parseScores(reply, candidates.size()), topN);
        } catch (RerankParseException e) {
            log.warn("Unusable batch judge reply, keeping pre-rerank order: {}", e.getMessage());
            return Reranker.inputOrder(candidates, topN);
        }
    }

    double[] parseScores(String reply, int expected) throws RerankParseException {
        if (reply == null || reply.isBlank()) {
            throw new RerankParseException("empty reply");
        }
        JsonNode root;
        try {
            root = mapper.readTree(jsonPart(reply));
        } catch (JsonProcessingException e) {
            throw new RerankParseException("reply is not JSON", e);
        }
        JsonNode scores = root.isArray() ? root : root.path("scores");
        if (!scores.isArray()) {
            throw new RerankParseException("no score array in reply");
        }
        if (scores.size() != expected) {
            throw new RerankParseException("expected " + expected + " scores but got " + scores.size());
        }
        double[] parsed = new double[expected];
        for (int i = 0; i < expected; i++) {
            JsonNode score = scores.get(i);
            if (!score.isNumber() || !Double.isFinite(score.asDouble())) {
                throw new RerankParseException("score " + i + " is not a number: " + score);
            }
            parsed[i] = score.asDouble();
        }
        return parsed;
    }

    // Judges backed by chat models often wrap the JSON in prose.
    private static String jsonPart(String reply) {
        int start = -1;
        for (int i = 0; i < reply.length(); i++) {
            char c = reply.charAt(i);
            if (c == '[' || c == '{') {
                start = i;
                break;
            }
        }
        int end = Math.max(reply.lastIndexOf(']'), reply.lastIndexOf('}'));
        if (start < 0 || end < start) {
            return reply;
        }
        return reply.substring(start, end + 1);
    }
}
