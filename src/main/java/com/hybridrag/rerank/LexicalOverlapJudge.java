package com.hybridrag.rerank;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;

public class LexicalOverlapJudge implements RelevanceJudge, BatchRelevanceJudge {
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public double score(String query, String document) {
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty() || document == null || document.isBlank()) {
            return 1d;
        }
        Set<String> words = terms(document);
        long matches = queryTerms.stream().filter(words::contains).count();
        return 1d + 9d * matches / queryTerms.size();
    }

    @Override
    public String judge(String query, List<String> documents) throws IOException {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("scores", documents.stream().map(document -> score(query, document)).toList());
        return mapper.writeValueAsString(reply);
    }

    private static Set<String> terms(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}
