package com.newsrelay.core.events;

import java.time.Instant;

public record CollectorTickCompleted(
        Instant timestamp,
        String collectorName,
        String cycleId,
        boolean success,
        long durationMillis,
        int itemCount
) implements Event {
    @Override
    public String type() {
        return "CollectorTickCompleted";
    }
}
