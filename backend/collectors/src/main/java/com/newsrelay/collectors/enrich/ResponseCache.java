package com.newsrelay.collectors.enrich;

import com.newsrelay.core.model.CacheEntry;
import com.newsrelay.core.util.HashingUtils;
import com.newsrelay.core.util.JsonUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

public class ResponseCache {
    private static final Logger LOGGER = Logger.getLogger(ResponseCache.class.getName());

    private final EnrichmentStore store;
    private final Duration ttl;
    private final Clock clock;

    public ResponseCache(EnrichmentStore store, Duration ttl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.ttl = Objects.requireNonNull(ttl, "ttl is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static String key(EnrichmentRequest request) {
        return HashingUtils.sha256(request.task().code()
                + "|" + request.contentIdentity()
                + "|" + JsonUtils.toCanonicalJson(request.params()));
    }

    public Optional<CacheEntry> lookup(EnrichmentRequest request) {
        Instant now = clock.instant();
        return store.cacheEntry(key(request)).filter(entry -> !entry.isExpired(now));
    }

    public void put(EnrichmentRequest request, LlmResponse response) {
        Instant now = clock.instant();
        store.putCacheEntry(new CacheEntry(
                key(request),
                request.task().code(),
                response.text(),
                (int) Math.min(Integer.MAX_VALUE, response.inputTokens()),
                (int) Math.min(Integer.MAX_VALUE, response.outputTokens()),
                now,
                now.plus(ttl)
        ));
    }

    public int sweep() {
        int removed = store.deleteExpiredCacheEntries(clock.instant());
        if (removed > 0) {
            LOGGER.info("Removed " + removed + " expired enrichment cache entries");
        }
        return removed;
    }

    public CacheStats stats() {
        return store.cacheStats(clock.instant());
    }
}
