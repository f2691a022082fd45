package com.newsrelay.core.model;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry(
        String cacheKey,
        String taskType,
        String response,
        int inputTokens,
        int outputTokens,
        Instant createdAt,
        Instant expiresAt
) {
    public CacheEntry {
        Objects.requireNonNull(cacheKey, "cacheKey is required");
        Objects.requireNonNull(response, "response is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
