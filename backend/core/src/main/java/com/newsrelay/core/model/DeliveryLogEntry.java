package com.newsrelay.core.model;

import java.time.Instant;
import java.util.Objects;

public record DeliveryLogEntry(String subscriberId, long itemId, Instant deliveredAt) {
    public DeliveryLogEntry {
        Objects.requireNonNull(subscriberId, "subscriberId is required");
    }

    public String key() {
        return key(subscriberId, itemId);
    }

    public static String key(String subscriberId, long itemId) {
        return subscriberId + "#" + itemId;
    }
}
