package com.newsrelay.collectors.api;

import com.newsrelay.core.model.NewsItem;

import java.util.List;
import java.util.Map;

public record CollectorResult(boolean success, String message, List<NewsItem> items, Map<String, Object> stats) {
    public CollectorResult {
        items = items == null ? List.of() : List.copyOf(items);
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static CollectorResult success(String message, List<NewsItem> items, Map<String, Object> stats) {
        return new CollectorResult(true, message, items, stats);
    }

    public static CollectorResult failure(String message, List<NewsItem> items, Map<String, Object> stats) {
        return new CollectorResult(false, message, items, stats);
    }
}
