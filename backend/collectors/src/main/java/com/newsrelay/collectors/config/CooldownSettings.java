package com.newsrelay.collectors.config;

import java.time.Duration;

public record CooldownSettings(
        Duration rateLimited,
        Duration forbidden,
        Duration notFound,
        Duration mirrorUnavailable,
        Duration streakWindow,
        int streakLimit,
        Duration streakCooldown,
        Duration minFetchInterval
) {
    public CooldownSettings {
        rateLimited = orDefault(rateLimited, Duration.ofMinutes(10));
        forbidden = orDefault(forbidden, Duration.ofMinutes(30));
        notFound = orDefault(notFound, Duration.ofHours(1));
        mirrorUnavailable = orDefault(mirrorUnavailable, Duration.ofMinutes(5));
        streakWindow = orDefault(streakWindow, Duration.ofMinutes(10));
        streakLimit = streakLimit <= 0 ? 5 : streakLimit;
        streakCooldown = orDefault(streakCooldown, Duration.ofMinutes(10));
        minFetchInterval = orDefault(minFetchInterval, Duration.ZERO);
    }

    public static CooldownSettings defaults() {
        return new CooldownSettings(null, null, null, null, null, 0, null, null);
    }

    static Duration orDefault(Duration value, Duration fallback) {
        return value == null || value.isNegative() ? fallback : value;
    }
}
