package com.newsrelay.core.events;

import java.time.Instant;

public record DeliveryFailed(Instant timestamp, String subscriberId, long itemId, String message) implements Event {
    @Override
    public String type() {
        return "DeliveryFailed";
    }
}
