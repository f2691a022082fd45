package com.newsrelay.collectors.rss;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.FetchOutcome;
import com.newsrelay.collectors.fetch.Deadline;
import com.newsrelay.collectors.fetch.FetchErrorCode;
import com.newsrelay.collectors.fetch.FetchException;
import com.newsrelay.collectors.support.FixtureUtils;
import com.newsrelay.collectors.support.InMemoryNewsStore;
import com.newsrelay.collectors.support.TestContexts;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.PublishedConfidence;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.model.SourceConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RssSourceFetcherTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void buildsCandidatesWithDateConfidence() throws Exception {
        String rss = FixtureUtils.fixture("fixtures/sample-rss.xml");
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/rss", exchange -> writeResponse(exchange, rss));
        server.start();

        SourceConfig source = SourceConfig.feed("city-news", url("/rss"), Category.MOSCOW);
        FetchOutcome outcome = new RssSourceFetcher().fetch(source, context(), Deadline.after(Duration.ofSeconds(5)));

        assertEquals(3, outcome.items().size());
        NewsItem first = outcome.items().get(0);
        assertEquals(Instant.parse("2026-02-09T15:30:00Z"), first.publishedAt());
        assertEquals(PublishedConfidence.HIGH, first.publishedConfidence());
        assertEquals("city-news", first.source());
        assertEquals(Category.MOSCOW, first.category());
        assertEquals(NOW, first.fetchedAt());

        NewsItem undated = outcome.items().get(2);
        assertEquals(PublishedConfidence.SURROGATE, undated.publishedConfidence());
        assertEquals(NOW, undated.publishedAt());

        assertEquals(1, outcome.dropped().size());
        assertEquals("https://news.example.ru/bad-date/", outcome.dropped().get(0).url());
        assertEquals(RejectReason.PARSE_DATE_FAILED, outcome.dropped().get(0).reason());
    }

    @Test
    void invalidXmlIsParseError() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/bad", exchange -> writeResponse(exchange, "<rss><channel><item><title>broken"));
        server.start();

        SourceConfig source = SourceConfig.feed("broken", url("/bad"), Category.RUSSIA);
        FetchException error = assertThrows(FetchException.class,
                () -> new RssSourceFetcher().fetch(source, context(), Deadline.after(Duration.ofSeconds(5))));

        assertEquals(FetchErrorCode.PARSE_ERROR, error.code());
    }

    @Test
    void relativeLinksResolveAgainstFeedUrl() throws Exception {
        String rss = "<rss><channel><item><title>Relative</title><link>/news/relative-1</link>"
                + "<pubDate>2026-02-09T19:00:00Z</pubDate></item></channel></rss>";
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/feed/rss", exchange -> writeResponse(exchange, rss));
        server.start();

        SourceConfig source = SourceConfig.feed("relative", url("/feed/rss"), Category.RUSSIA);
        FetchOutcome outcome = new RssSourceFetcher().fetch(source, context(), Deadline.after(Duration.ofSeconds(5)));

        assertEquals(url("/news/relative-1"), outcome.items().get(0).url());
    }

    private CollectorContext context() {
        return TestContexts.context(TestContexts.strictBus(), new InMemoryNewsStore(),
                Clock.fixed(NOW, ZoneOffset.UTC), TestContexts.fastSettings());
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    private static void writeResponse(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/rss+xml; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
