package com.newsrelay.core.events;

import java.time.Instant;

public record ItemAccepted(
        Instant timestamp,
        long itemId,
        String source,
        String category,
        String url
) implements Event {
    @Override
    public String type() {
        return "ItemAccepted";
    }
}
