package com.newsrelay.collectors.site;

import com.newsrelay.core.model.PublishedConfidence;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PageDatesTest {

    @Test
    void metaTagWinsOverTimeElement() {
        Document doc = Jsoup.parse("<html><head><meta property='article:published_time' content='2026-02-09T10:00:00Z'></head>"
                + "<body><time datetime='2026-02-01T10:00:00Z'>1 Feb</time></body></html>");

        PageDate date = PageDates.extract(doc, "https://a.example/news/1");

        assertEquals(Instant.parse("2026-02-09T10:00:00Z"), date.publishedAt());
        assertEquals(PublishedConfidence.HIGH, date.confidence());
    }

    @Test
    void readsJsonLdGraph() {
        Document doc = Jsoup.parse("<html><head><script type='application/ld+json'>"
                + "{\"@graph\": [{\"@type\": \"WebPage\"}, {\"@type\": \"NewsArticle\", \"datePublished\": \"2026-02-09T11:00:00+03:00\"}]}"
                + "</script></head><body></body></html>");

        PageDate date = PageDates.extract(doc, "https://a.example/news/1");

        assertEquals(Instant.parse("2026-02-09T08:00:00Z"), date.publishedAt());
        assertEquals(PublishedConfidence.HIGH, date.confidence());
    }

    @Test
    void malformedJsonLdFallsThroughToTimeElement() {
        Document doc = Jsoup.parse("<html><head><script type='application/ld+json'>{not json</script></head>"
                + "<body><time datetime='2026-02-09T07:00:00Z'>today</time></body></html>");

        PageDate date = PageDates.extract(doc, "https://a.example/news/1");

        assertEquals(Instant.parse("2026-02-09T07:00:00Z"), date.publishedAt());
        assertEquals(PublishedConfidence.MEDIUM, date.confidence());
    }

    @Test
    void urlDateIsLowConfidence() {
        PageDate date = PageDates.extract(Jsoup.parse("<p>text</p>"), "https://a.example/2026/02/08/story/");

        assertEquals(Instant.parse("2026-02-08T00:00:00Z"), date.publishedAt());
        assertEquals(PublishedConfidence.LOW, date.confidence());
    }

    @Test
    void nothingFoundIsUnknown() {
        PageDate date = PageDates.extract(Jsoup.parse("<p>text</p>"), "https://a.example/news/story");

        assertNull(date.publishedAt());
        assertEquals(PublishedConfidence.NONE, date.confidence());
    }
}
