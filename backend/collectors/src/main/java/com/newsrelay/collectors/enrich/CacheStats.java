package com.newsrelay.collectors.enrich;

public record CacheStats(long total, long active, long expired) {
}
