package com.newsrelay.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.enrich.LlmCallException;
import com.newsrelay.collectors.enrich.LlmResponse;
import com.newsrelay.core.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCompletionLlmServiceTest {
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void sendsAuthorizedRequestAndReadsUsage() throws Exception {
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> requestBody = new AtomicReference<>();
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            writeResponse(exchange, 200, """
                    {"choices":[{"message":{"role":"assistant","content":"  Мост открыли в Лефортове.  "}}],
                     "usage":{"prompt_tokens":321,"completion_tokens":17}}
                    """);
        });
        server.start();

        LlmResponse response = service("secret-key").call(EnrichmentTask.SUMMARY, "Текст статьи", Map.of("title", "Мост"));

        assertEquals("Bearer secret-key", authorization.get());
        assertEquals("Мост открыли в Лефортове.", response.text());
        assertEquals(321, response.inputTokens());
        assertEquals(17, response.outputTokens());

        JsonNode body = JsonUtils.objectMapper().readTree(requestBody.get());
        assertEquals("deepseek-chat", body.path("model").asText());
        assertEquals(EnrichmentTask.SUMMARY.maxOutputTokens(), body.path("max_tokens").asInt());
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertTrue(body.path("messages").path(1).path("content").asText().contains("Текст статьи"));
        assertTrue(body.path("response_format").isMissingNode());
    }

    @Test
    void estimatesTokensWhenUsageIsMissing() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange ->
                writeResponse(exchange, 200, "{\"choices\":[{\"message\":{\"content\":\"короткий ответ\"}}]}"));
        server.start();

        String payload = "x".repeat(400);
        LlmResponse response = service("key").call(EnrichmentTask.CLEANUP, payload, Map.of());

        assertEquals(100, response.inputTokens());
        assertEquals(LlmResponse.estimateTokens("короткий ответ"), response.outputTokens());
    }

    @Test
    void nonSuccessStatusIsReported() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> writeResponse(exchange, 429, "{\"error\":\"rate limited\"}"));
        server.start();

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> service("key").call(EnrichmentTask.SUMMARY, "text", Map.of()));

        assertEquals(429, error.status());
    }

    @Test
    void emptyContentIsAFailure() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> writeResponse(exchange, 200, "{\"choices\":[]}"));
        server.start();

        LlmCallException error = assertThrows(LlmCallException.class,
                () -> service("key").call(EnrichmentTask.TRANSLATION, "text", Map.of()));

        assertTrue(error.getMessage().contains("has no content"));
    }

    @Test
    void hashtagRequestsAskForJsonAndListAllowedValues() throws Exception {
        ChatCompletionLlmService service = new ChatCompletionLlmService(
                HttpClient.newHttpClient(), LlmSettings.defaults(), "key");

        String json = service.requestBody(EnrichmentTask.HASHTAGS, "Текст", Map.of(
                "allowedG1", List.of("ЦФО", "СЗФО"),
                "allowedR0", List.of("Москва")
        ));
        JsonNode body = JsonUtils.objectMapper().readTree(json);

        assertEquals("json_object", body.path("response_format").path("type").asText());
        String system = body.path("messages").path(0).path("content").asText();
        assertTrue(system.contains("ЦФО"));
        assertFalse(system.isBlank());
    }

    @Test
    void blankApiKeyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChatCompletionLlmService(HttpClient.newHttpClient(), LlmSettings.defaults(), " "));
    }

    private ChatCompletionLlmService service(String apiKey) {
        LlmSettings settings = new LlmSettings(
                "http://localhost:" + server.getAddress().getPort() + "/v1/chat/completions",
                null,
                Duration.ofSeconds(5),
                0.2
        );
        return new ChatCompletionLlmService(HttpClient.newHttpClient(), settings, apiKey);
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
