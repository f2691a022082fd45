package com.newsrelay.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String source,
        String url,
        String status,
        String errorCode,
        int itemCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
