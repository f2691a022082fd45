package com.newsrelay.collectors.api;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;

import java.util.List;

public record FetchOutcome(List<NewsItem> items, List<DroppedEntry> dropped, boolean notModified) {
    public FetchOutcome {
        items = items == null ? List.of() : List.copyOf(items);
        dropped = dropped == null ? List.of() : List.copyOf(dropped);
    }

    public static FetchOutcome of(List<NewsItem> items, List<DroppedEntry> dropped) {
        return new FetchOutcome(items, dropped, false);
    }

    public static FetchOutcome notModifiedOutcome() {
        return new FetchOutcome(List.of(), List.of(), true);
    }

    public record DroppedEntry(String url, RejectReason reason) {
    }
}
