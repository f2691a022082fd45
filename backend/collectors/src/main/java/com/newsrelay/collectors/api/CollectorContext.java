package com.newsrelay.collectors.api;

import com.newsrelay.collectors.config.CollectorSettings;
import com.newsrelay.collectors.fetch.HttpFetcher;
import com.newsrelay.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record CollectorContext(
        HttpFetcher fetcher,
        EventBus eventBus,
        NewsStore newsStore,
        Clock clock,
        CollectorSettings settings
) {
    public CollectorContext {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(newsStore, "newsStore is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
