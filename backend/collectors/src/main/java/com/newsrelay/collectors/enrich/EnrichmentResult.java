package com.newsrelay.collectors.enrich;

import java.util.Optional;

public record EnrichmentResult(EnrichmentStatus status, String response, long inputTokens, long outputTokens) {
    public static EnrichmentResult of(EnrichmentStatus status) {
        return new EnrichmentResult(status, null, 0, 0);
    }

    public boolean cacheHit() {
        return status == EnrichmentStatus.CACHE_HIT;
    }

    public Optional<String> text() {
        if (!status.hasResponse() || response == null || response.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(response.trim());
    }
}
