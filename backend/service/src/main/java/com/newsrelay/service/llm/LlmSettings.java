package com.newsrelay.service.llm;

import java.time.Duration;

public record LlmSettings(String endpoint, String model, Duration requestTimeout, double temperature) {
    public LlmSettings {
        endpoint = endpoint == null || endpoint.isBlank() ? "https://api.deepseek.com/v1/chat/completions" : endpoint.trim();
        model = model == null || model.isBlank() ? "deepseek-chat" : model.trim();
        requestTimeout = requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()
                ? Duration.ofSeconds(10)
                : requestTimeout;
        temperature = temperature < 0 ? 0.2 : temperature;
    }

    public static LlmSettings defaults() {
        return new LlmSettings(null, null, null, 0.2);
    }
}
