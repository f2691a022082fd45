package com.newsrelay.collectors.enrich;

import java.util.Map;
import java.util.Objects;

public record EnrichmentRequest(EnrichmentTask task, String contentIdentity, String payload, Map<String, Object> params) {
    public EnrichmentRequest {
        Objects.requireNonNull(task, "task is required");
        Objects.requireNonNull(payload, "payload is required");
        contentIdentity = contentIdentity == null || contentIdentity.isBlank() ? payload : contentIdentity;
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static EnrichmentRequest of(EnrichmentTask task, String contentIdentity, String payload) {
        return new EnrichmentRequest(task, contentIdentity, payload, Map.of());
    }
}
