package com.newsrelay.collectors.classify;

import com.newsrelay.collectors.config.BudgetSettings;
import com.newsrelay.collectors.config.EnrichmentSettings;
import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.support.InMemoryEnrichmentStore;
import com.newsrelay.collectors.support.StubLlmService;
import com.newsrelay.collectors.support.TestContexts;
import com.newsrelay.collectors.support.TestItems;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ItemClassifierTest {
    private final StubLlmService llm = new StubLlmService();
    private final EnrichmentGateway gateway = new EnrichmentGateway(
            EnrichmentSettings.enabledWith(BudgetSettings.defaults(), 0), llm, new InMemoryEnrichmentStore(),
            TestContexts.strictBus(), null, Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC));

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void ruleSignalSkipsVerification() {
        llm.answer(EnrichmentTask.HASHTAGS, "{}");
        NewsItem item = TestItems.extracted("https://a.example/1", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT, Category.RUSSIA);

        NewsItem classified = ItemClassifier.withGateway(gateway).classify(item);

        assertEquals(Category.MOSCOW, classified.category());
        assertEquals(0, llm.callCount(EnrichmentTask.CATEGORY_VERIFY));
        assertEquals(List.of("#Russia", "#CentralFD", "#Moscow", "#Society"), classified.hashtags());
    }

    @Test
    void ambiguousItemIsVerified() {
        llm.answer(EnrichmentTask.CATEGORY_VERIFY, "\"moscow\".")
                .answer(EnrichmentTask.HASHTAGS, "{\"r0\":\"#Economy\"}");
        NewsItem item = TestItems.extracted("https://a.example/2", "Цены на гречку выросли",
                "Эксперты объяснили причины роста цен.", Category.RUSSIA);

        NewsItem classified = ItemClassifier.withGateway(gateway).classify(item);

        assertEquals(Category.MOSCOW, classified.category());
        assertEquals(1, llm.callCount(EnrichmentTask.CATEGORY_VERIFY));
        assertEquals(List.of("#Russia", "#CentralFD", "#Moscow", "#Economy"), classified.hashtags());
    }

    @Test
    void unreadableVerificationKeepsFallback() {
        llm.answer(EnrichmentTask.CATEGORY_VERIFY, "не знаю")
                .answer(EnrichmentTask.HASHTAGS, "{}");
        NewsItem item = TestItems.extracted("https://a.example/3", "Цены на гречку выросли",
                "Эксперты объяснили причины роста цен.", Category.RUSSIA);

        NewsItem classified = ItemClassifier.withGateway(gateway).classify(item);

        assertEquals(Category.RUSSIA, classified.category());
    }
}
