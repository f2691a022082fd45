package com.newsrelay.collectors.config;

import java.time.Duration;

public record CollectorSettings(
        int concurrency,
        Duration sourceTimeout,
        Duration requestTimeout,
        Integer retries,
        Duration retryBackoff,
        int maxArticlesPerSource,
        Duration maxItemAge,
        Boolean requirePublishedDate,
        Boolean allowInsecureFallback,
        CooldownSettings cooldown
) {
    public CollectorSettings {
        concurrency = concurrency <= 0 ? 6 : concurrency;
        sourceTimeout = CooldownSettings.orDefault(sourceTimeout, Duration.ofSeconds(60));
        requestTimeout = CooldownSettings.orDefault(requestTimeout, Duration.ofSeconds(30));
        retries = retries == null || retries < 0 ? 2 : retries;
        retryBackoff = CooldownSettings.orDefault(retryBackoff, Duration.ofMillis(500));
        maxArticlesPerSource = maxArticlesPerSource <= 0 ? 8 : maxArticlesPerSource;
        maxItemAge = CooldownSettings.orDefault(maxItemAge, Duration.ofHours(48));
        requirePublishedDate = requirePublishedDate == null ? Boolean.TRUE : requirePublishedDate;
        allowInsecureFallback = allowInsecureFallback == null ? Boolean.TRUE : allowInsecureFallback;
        cooldown = cooldown == null ? CooldownSettings.defaults() : cooldown;
    }

    public static CollectorSettings defaults() {
        return new CollectorSettings(0, null, null, 2, null, 0, null, null, null, null);
    }

    public CollectorSettings withTimeouts(Duration nextSourceTimeout, Duration nextRequestTimeout) {
        return new CollectorSettings(
                concurrency, nextSourceTimeout, nextRequestTimeout, retries, retryBackoff, maxArticlesPerSource,
                maxItemAge, requirePublishedDate, allowInsecureFallback, cooldown
        );
    }
}
