package com.newsrelay.core.model;

import java.time.Instant;
import java.util.Objects;

public record DeliveryState(
        String subscriberId,
        boolean paused,
        long pauseVersion,
        long lastDeliveredItemId,
        Instant updatedAt
) {
    public DeliveryState {
        Objects.requireNonNull(subscriberId, "subscriberId is required");
    }

    public static DeliveryState initial(String subscriberId) {
        return new DeliveryState(subscriberId, false, 0L, 0L, null);
    }

    public DeliveryState transition(boolean nextPaused, Instant at) {
        return new DeliveryState(subscriberId, nextPaused, pauseVersion + 1, lastDeliveredItemId, at);
    }

    public DeliveryState withLastDelivered(long itemId, Instant at) {
        return new DeliveryState(subscriberId, paused, pauseVersion, itemId, at);
    }
}
