package com.hybridrag.rerank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;

import okhttp3.OkHttpClient;

class HttpRelevanceJudgeTest {
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "{}";
    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/judge", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] body = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void shouldPostPairAndReadScore() throws Exception {
        reply = "{\"score\":7.5}";

        assertEquals(7.5d, judge().score("solar", "solar panels"), 1e-9);

        JsonNode sent = new ObjectMapper().readTree(requestBody.get());
        assertEquals("solar", sent.path("query").asText());
        assertEquals("solar panels", sent.path("document").asText());
        assertEquals("Bearer key", authorization.get());
    }

    @Test
    void shouldReturnRawBatchReply() throws Exception {
        reply = "Scores: [4, 2]";

        assertEquals("Scores: [4, 2]", judge().judge("solar", List.of("a", "b")));
        assertEquals(2, new ObjectMapper().readTree(requestBody.get()).path("documents").size());
    }

    @Test
    void shouldSignalRateLimiting() {
        status = 429;

        assertThrows(JudgeRateLimitedException.class, () -> judge().score("solar", "panels"));
    }

    @Test
    void shouldFailOnMissingScoreOrServerError() {
        reply = "{\"relevance\":\"high\"}";
        assertThrows(IOException.class, () -> judge().score("solar", "panels"));

        status = 500;
        assertThrows(IOException.class, () -> judge().judge("solar", List.of("panels")));
    }

    private HttpRelevanceJudge judge() {
        return new HttpRelevanceJudge(new OkHttpClient(), "http://127.0.0.1:" + server.getAddress().getPort() + "/judge", "key");
    }
}
