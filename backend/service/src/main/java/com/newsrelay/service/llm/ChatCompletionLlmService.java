package com.newsrelay.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.enrich.LlmCallException;
import com.newsrelay.collectors.enrich.LlmResponse;
import com.newsrelay.collectors.enrich.LlmService;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public final class ChatCompletionLlmService implements LlmService {
    private static final Logger LOGGER = Logger.getLogger(ChatCompletionLlmService.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final LlmSettings settings;
    private final String apiKey;

    public ChatCompletionLlmService(HttpClient httpClient, LlmSettings settings, String apiKey) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.settings = settings == null ? LlmSettings.defaults() : settings;
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        this.apiKey = apiKey.trim();
    }

    @Override
    public LlmResponse call(EnrichmentTask task, String payload, Map<String, Object> params) throws LlmCallException {
        Map<String, Object> safeParams = params == null ? Map.of() : params;
        HttpRequest request = HttpRequest.newBuilder(URI.create(settings.endpoint()))
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(task, payload, safeParams), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LlmCallException("LLM request failed for task " + task.code(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("LLM request interrupted for task " + task.code(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new LlmCallException("LLM request for task " + task.code() + " failed with status " + response.statusCode(),
                    response.statusCode());
        }
        return parseResponse(task, payload, response.body());
    }

    String requestBody(EnrichmentTask task, String payload, Map<String, Object> params) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", settings.model());
        body.put("temperature", settings.temperature());
        body.put("max_tokens", task.maxOutputTokens());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", TaskPrompts.system(task, params));
        messages.addObject().put("role", "user").put("content", TaskPrompts.user(task, payload == null ? "" : payload, params));
        if (task == EnrichmentTask.HASHTAGS) {
            body.putObject("response_format").put("type", "json_object");
        }
        try {
            return MAPPER.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize LLM request", e);
        }
    }

    private static LlmResponse parseResponse(EnrichmentTask task, String payload, String body) throws LlmCallException {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new LlmCallException("Unreadable LLM response for task " + task.code(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new LlmCallException("LLM response for task " + task.code() + " has no content", 200);
        }
        String text = content.asText().trim();
        JsonNode usage = root.path("usage");
        long inputTokens = usage.path("prompt_tokens").asLong(0);
        long outputTokens = usage.path("completion_tokens").asLong(0);
        if (inputTokens == 0 && outputTokens == 0) {
            LOGGER.fine("LLM response for " + task.code() + " carries no usage; estimating tokens");
            inputTokens = LlmResponse.estimateTokens(payload);
            outputTokens = LlmResponse.estimateTokens(text);
        }
        return new LlmResponse(text, inputTokens, outputTokens);
    }
}
