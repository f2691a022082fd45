package com.newsrelay.core.events;

import java.time.Instant;

public record CollectorTickStarted(Instant timestamp, String collectorName, String cycleId) implements Event {
    @Override
    public String type() {
        return "CollectorTickStarted";
    }
}
