package com.newsrelay.service.config;

import java.time.Duration;

public record ScheduleSettings(Duration collectInterval, Duration cacheSweepInterval, Boolean enabled) {
    public ScheduleSettings {
        collectInterval = positiveOr(collectInterval, Duration.ofMinutes(5));
        cacheSweepInterval = positiveOr(cacheSweepInterval, Duration.ofHours(1));
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public static ScheduleSettings defaults() {
        return new ScheduleSettings(null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
