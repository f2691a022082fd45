package com.newsrelay.core.model;

import java.util.Objects;
import java.util.Set;

public record Subscriber(String id, Set<Category> categories, Set<String> enabledSources) {
    public Subscriber {
        Objects.requireNonNull(id, "id is required");
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        enabledSources = enabledSources == null ? Set.of() : Set.copyOf(enabledSources);
    }

    public static Subscriber unfiltered(String id) {
        return new Subscriber(id, Set.of(), Set.of());
    }

    public boolean accepts(NewsItem item) {
        if (!categories.isEmpty() && !categories.contains(item.category())) {
            return false;
        }
        return enabledSources.isEmpty() || enabledSources.contains(item.source());
    }
}
