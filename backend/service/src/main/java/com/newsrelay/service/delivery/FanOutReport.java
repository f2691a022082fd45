package com.newsrelay.service.delivery;

import java.util.EnumMap;
import java.util.Map;

public record FanOutReport(long itemId, Map<DeliveryOutcome, Integer> outcomes) {
    public FanOutReport {
        outcomes = outcomes == null || outcomes.isEmpty() ? Map.of() : new EnumMap<>(outcomes);
    }

    public int count(DeliveryOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int delivered() {
        return count(DeliveryOutcome.DELIVERED);
    }
}
