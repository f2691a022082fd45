package com.newsrelay.core.events;

import java.time.Instant;

public record ItemDelivered(Instant timestamp, String subscriberId, long itemId, boolean replay) implements Event {
    @Override
    public String type() {
        return "ItemDelivered";
    }
}
