package com.newsrelay.collectors.enrich;

public record LlmResponse(String text, long inputTokens, long outputTokens) {
    public LlmResponse {
        text = text == null ? "" : text;
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
    }

    public static long estimateTokens(String text) {
        return text == null ? 0 : Math.max(1, text.length() / 4);
    }
}
