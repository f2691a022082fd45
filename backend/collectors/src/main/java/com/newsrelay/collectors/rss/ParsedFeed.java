package com.newsrelay.collectors.rss;

import java.util.List;

public record ParsedFeed(List<FeedEntry> entries, boolean invalidXml) {
    public ParsedFeed {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    static ParsedFeed invalid() {
        return new ParsedFeed(List.of(), true);
    }
}
