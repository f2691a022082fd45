package com.newsrelay.collectors.rss;

public record FeedEntry(String guid, String title, String link, String summary, String rawDate) {
}
