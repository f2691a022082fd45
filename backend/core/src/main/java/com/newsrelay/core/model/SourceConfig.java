package com.newsrelay.core.model;

import java.util.List;
import java.util.Objects;

public record SourceConfig(
        String url,
        String source,
        Category category,
        SourceType type,
        SourceTier tier,
        List<String> mirrors,
        String linkSelector,
        Boolean enabled
) {
    public SourceConfig {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(category, "category is required");
        type = type == null ? SourceType.RSS : type;
        tier = tier == null ? SourceTier.STANDARD : tier;
        mirrors = mirrors == null ? List.of() : List.copyOf(mirrors);
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public static SourceConfig feed(String source, String url, Category category) {
        return new SourceConfig(url, source, category, SourceType.RSS, SourceTier.STANDARD, List.of(), null, true);
    }

    public SourceConfig withUrl(String nextUrl) {
        return new SourceConfig(nextUrl, source, category, type, tier, mirrors, linkSelector, enabled);
    }
}
