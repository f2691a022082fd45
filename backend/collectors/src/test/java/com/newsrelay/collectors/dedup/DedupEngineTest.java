package com.newsrelay.collectors.dedup;

import com.newsrelay.collectors.config.DedupSettings;
import com.newsrelay.collectors.support.InMemoryNewsStore;
import com.newsrelay.collectors.support.MutableClock;
import com.newsrelay.collectors.support.TestItems;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.util.HashingUtils;
import com.newsrelay.core.util.SimHash;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DedupEngineTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    private final InMemoryNewsStore store = new InMemoryNewsStore();
    private final MutableClock clock = new MutableClock(NOW);
    private final DedupEngine dedup = new DedupEngine(store, DedupSettings.defaults(), clock);

    @Test
    void sameUrlIsSeenAfterAcceptance() {
        accept("https://news.example.ru/2026/02/09/most/", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT);

        NewsItem again = dedup.withUrlKeys(TestItems.extracted(
                "https://news.example.ru/2026/02/09/most/", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT, Category.MOSCOW));

        assertEquals(Optional.of(RejectReason.DUPLICATE_SEEN), dedup.checkSeen(again));
    }

    @Test
    void trackingVariantOfSameUrlIsDuplicateUrl() {
        accept("https://news.example.ru/2026/02/09/most/", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT);

        NewsItem variant = dedup.withUrlKeys(TestItems.extracted(
                "https://NEWS.example.ru/2026/02/09/most?utm_source=tg", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT, Category.MOSCOW));

        assertEquals(Optional.of(RejectReason.DUPLICATE_URL), dedup.checkSeen(variant));
    }

    @Test
    void guidIsASeenKey() {
        NewsItem first = TestItems.extracted("https://a.example/1", "Title", "text", Category.RUSSIA);
        NewsItem withGuid = new NewsItem(null, "guid-77", first.url(), first.title(), first.source(), first.sourceType(),
                first.sourceTier(), first.category(), null, first.rawText(), first.cleanText(), first.textOrigin(), null, null,
                null, null, first.publishedAt(), first.publishedConfidence(), 0.0, List.of(), null, first.fetchedAt(), null);
        store.markSeen(dedup.seenKeys(dedup.withUrlKeys(withGuid)), NOW);

        NewsItem sameGuidOtherUrl = new NewsItem(null, "guid-77", "https://a.example/moved", "Title", first.source(),
                first.sourceType(), first.sourceTier(), first.category(), null, null, null, null, null, null, null, null,
                first.publishedAt(), first.publishedConfidence(), 0.0, List.of(), null, first.fetchedAt(), null);

        assertEquals(Optional.of(RejectReason.DUPLICATE_SEEN), dedup.checkSeen(dedup.withUrlKeys(sameGuidOtherUrl)));
        assertEquals(3, dedup.seenKeys(withGuid).size());
    }

    @Test
    void identicalTextUnderAnotherUrlIsChecksumDuplicate() {
        accept("https://first.example/a", TestItems.SCHOOL_TITLE, TestItems.SCHOOL_TEXT);

        NewsItem copy = fingerprinted("https://second.example/b", "Совсем другой заголовок", TestItems.SCHOOL_TEXT);

        assertEquals(Optional.of(RejectReason.DUPLICATE_CHECKSUM), dedup.checkContent(copy));
    }

    @Test
    void rewordedCopyIsSimhashDuplicate() {
        accept("https://first.example/a", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT);

        NewsItem reworded = fingerprinted("https://second.example/b", TestItems.MOSCOW_NEAR_TITLE, TestItems.MOSCOW_NEAR_TEXT);

        assertEquals(Optional.of(RejectReason.DUPLICATE_SIMHASH), dedup.checkContent(reworded));
    }

    @Test
    void unrelatedArticlesPass() {
        accept("https://first.example/a", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT);
        accept("https://first.example/b", TestItems.TULA_TITLE, TestItems.TULA_TEXT);

        NewsItem other = fingerprinted("https://second.example/c", TestItems.SCHOOL_TITLE, TestItems.SCHOOL_TEXT);

        assertTrue(dedup.checkContent(other).isEmpty());
    }

    @Test
    void similarHeadlineWithDifferentTextIsTitleDuplicate() {
        accept("https://first.example/a", TestItems.MOSCOW_TITLE, TestItems.MOSCOW_TEXT);

        NewsItem sameStory = fingerprinted("https://second.example/b", "В Москве открыли новый пешеходный мост через Яузу!",
                TestItems.SCHOOL_TEXT);

        assertEquals(Optional.of(RejectReason.DUPLICATE_TITLE), dedup.checkContent(sameStory));
    }

    @Test
    void contentOutsideWindowIsNotDuplicate() {
        accept("https://first.example/a", TestItems.SCHOOL_TITLE, TestItems.SCHOOL_TEXT);
        clock.advance(Duration.ofHours(49));

        NewsItem copy = fingerprinted("https://second.example/b", "Совсем другой заголовок", TestItems.SCHOOL_TEXT);

        assertTrue(dedup.checkContent(copy).isEmpty());
    }

    @Test
    void titleSimilarityRules() {
        List<NewsItem> recent = List.of(TestItems.extracted("https://a.example/1",
                "Мэрия Москвы утвердила план благоустройства набережных на весну", "", Category.MOSCOW));

        assertTrue(dedup.isTitleDuplicate("Мэрия Москвы утвердила план благоустройства набережных на весну", recent));
        assertTrue(dedup.isTitleDuplicate("Срочно: мэрия Москвы утвердила план благоустройства набережных на весну 2026", recent));
        assertFalse(dedup.isTitleDuplicate("Мэрия Казани утвердила бюджет", recent));
        assertFalse(dedup.isTitleDuplicate("!!!", recent));
    }

    private void accept(String url, String title, String text) {
        NewsItem item = fingerprinted(url, title, text);
        assertTrue(store.accept(item, dedup.seenKeys(item), clock.instant()).isPresent());
    }

    private NewsItem fingerprinted(String url, String title, String text) {
        NewsItem item = dedup.withUrlKeys(TestItems.extracted(url, title, text, Category.RUSSIA));
        return item.withFingerprints(HashingUtils.contentChecksum(text), SimHash.fingerprint(title, text), 0.6);
    }
}
