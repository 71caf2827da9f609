package com.hybridrag.ingest;

import java.io.IOException;
import java.util.ArrayList;
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

public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int TOO_MANY_REQUESTS = 429;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> batch) throws EmbeddingException {
        if (batch.isEmpty()) {
            return List.of();
        }
        Request request = buildRequest(batch);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (response.code() == TOO_MANY_REQUESTS) {
                throw new EmbeddingException("Embedding provider rate limited the request", batch, true, null);
            }
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingException("Embedding provider returned HTTP " + response.code(), batch);
            }
            return parseVectors(mapper.readTree(body.string()), batch);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), batch, false, e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + model + "/" + dimension;
    }

    private Request buildRequest(List<String> batch) throws EmbeddingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", batch);
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new EmbeddingException("Unable to serialize embedding request", batch, false, e);
        }
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(json, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        return requestBuilder.build();
    }

    private List<float[]> parseVectors(JsonNode root, List<String> batch) throws EmbeddingException {
        List<JsonNode> vectorNodes = new ArrayList<>();
        if (root.path("data").isArray()) {
            root.path("data").forEach(item -> vectorNodes.add(item.path("embedding")));
        } else if (root.path("embeddings").isArray()) {
            root.path("embeddings").forEach(vectorNodes::add);
        }
        if (vectorNodes.size() != batch.size()) {
            throw new EmbeddingException("Expected " + batch.size() + " vectors but received " + vectorNodes.size(), batch);
        }

        List<float[]> vectors = new ArrayList<>(vectorNodes.size());
        for (JsonNode vectorNode : vectorNodes) {
            if (!vectorNode.isArray() || vectorNode.size() != dimension) {
                throw new EmbeddingException("Embedding has wrong shape, expected dimension " + dimension, batch);
            }
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
