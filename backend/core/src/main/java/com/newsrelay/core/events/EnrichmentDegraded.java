package com.newsrelay.core.events;

import java.time.Instant;

public record EnrichmentDegraded(Instant timestamp, String feature, String reason) implements Event {
    @Override
    public String type() {
        return "EnrichmentDegraded";
    }
}
