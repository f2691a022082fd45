package com.newsrelay.core.model;

import java.time.Instant;
import java.util.Objects;

public record SourceFetchState(
        String source,
        Instant nextFetchAt,
        Instant lastFetchAt,
        String lastStatus,
        int errorStreak,
        Instant lastErrorAt,
        String lastErrorCode
) {
    public SourceFetchState {
        Objects.requireNonNull(source, "source is required");
    }

    public static SourceFetchState initial(String source) {
        return new SourceFetchState(source, null, null, null, 0, null, null);
    }

    public boolean inCooldown(Instant now) {
        return nextFetchAt != null && nextFetchAt.isAfter(now);
    }
}
