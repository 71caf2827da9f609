package com.hybridrag.ingest;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        String endpoint = System.getenv("HYBRIDRAG_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(dimension);
        }
        String model = System.getenv().getOrDefault("HYBRIDRAG_EMBEDDING_MODEL", "text-embedding-3-small");
        String apiKey = System.getenv("HYBRIDRAG_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, model, apiKey, dimension);
    }
}
