package com.hybridrag.rerank;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpRelevanceJudge implements RelevanceJudge, BatchRelevanceJudge {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int TOO_MANY_REQUESTS = 429;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;

    public HttpRelevanceJudge(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public double score(String query, String document) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("document", document);
        JsonNode score = mapper.readTree(post(payload)).path("score");
        if (!score.isNumber()) {
            throw new IOException("Judge reply has no numeric score");
        }
        return score.asDouble();
    }

    @Override
    public String judge(String query, List<String> documents) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("documents", documents);
        return post(payload);
    }

    private String post(Map<String, Object> payload) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (response.code() == TOO_MANY_REQUESTS) {
                throw new JudgeRateLimitedException("Judge rate limited the request");
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Judge returned HTTP " + response.code());
            }
            return body.string();
        }
    }
}
