package com.newsrelay.collectors.quality;

import com.newsrelay.collectors.support.TestItems;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.PublishedConfidence;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceTier;
import com.newsrelay.core.model.SourceType;
import com.newsrelay.core.model.TextOrigin;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentQualityScorerTest {
    private final ContentQualityScorer scorer = new ContentQualityScorer(QualityProfiles.defaults());

    @Test
    void scoreRewardsLengthAndSentences() {
        double shortScore = ContentQualityScorer.score("Одна короткая фраза.");
        double articleScore = ContentQualityScorer.score(TestItems.MOSCOW_TEXT);

        assertTrue(articleScore > 0.5, "article scored " + articleScore);
        assertTrue(shortScore < 0.1, "short text scored " + shortScore);
        assertEquals(0.0, ContentQualityScorer.score("   "));
        assertEquals(0.0, ContentQualityScorer.score(null));
    }

    @Test
    void fullLengthArticleReachesCeiling() {
        String longText = (TestItems.MOSCOW_TEXT + "\n" + TestItems.SCHOOL_TEXT + "\n" + TestItems.TULA_TEXT);

        assertEquals(0.8, ContentQualityScorer.score(longText), 1e-9);
    }

    @Test
    void noiseAndRepeatedLinesArePenalised() {
        String clean = TestItems.SCHOOL_TEXT;
        String noisy = clean + " Подписывайтесь на наш telegram. Читайте также другие материалы.";
        String repeated = "Строка повторяется много раз.\nСтрока повторяется много раз.\nСтрока повторяется много раз.";

        assertTrue(ContentQualityScorer.score(noisy) < ContentQualityScorer.score(clean));
        assertTrue(ContentQualityScorer.score(repeated) < ContentQualityScorer.score("Строка повторяется много раз."
                + "\nДругая строка текста.\nЕще одна строка."));
    }

    @Test
    void shortTextIsTooShortBeforeLowQuality() {
        NewsItem item = TestItems.extracted("https://a.example/1", "Заголовок", "Коротко.", Category.RUSSIA);

        QualityVerdict verdict = scorer.evaluate(item);

        assertEquals(RejectReason.TOO_SHORT, verdict.rejectReason());
    }

    @Test
    void longButShapelessTextIsLowQuality() {
        String shapeless = "слово ".repeat(60).trim();
        NewsItem item = TestItems.extracted("https://a.example/1", "Заголовок", shapeless, Category.RUSSIA);

        QualityVerdict verdict = scorer.evaluate(item);

        assertEquals(RejectReason.LOW_QUALITY, verdict.rejectReason());
    }

    @Test
    void realArticlePassesStandardProfile() {
        NewsItem item = TestItems.extracted("https://a.example/1", TestItems.TULA_TITLE, TestItems.TULA_TEXT, Category.RUSSIA);

        QualityVerdict verdict = scorer.evaluate(item);

        assertTrue(verdict.accepted());
        assertNull(verdict.rejectReason());
    }

    @Test
    void highVolumeTierIsStricter() {
        SourceConfig wire = new SourceConfig("https://wire.example/rss", "wire", Category.RUSSIA, SourceType.RSS,
                SourceTier.HIGH_VOLUME, List.of(), null, true);
        Instant at = Instant.parse("2026-02-09T19:00:00Z");
        NewsItem item = NewsItem.candidate(wire, null, "https://wire.example/1", TestItems.TULA_TITLE, null, at,
                PublishedConfidence.HIGH, at).withText(TestItems.TULA_TEXT, TestItems.TULA_TEXT, TextOrigin.FEED);

        assertEquals(RejectReason.LOW_QUALITY, scorer.evaluate(item).rejectReason());
    }

    @Test
    void titleFallbackUsesRelaxedThresholds() {
        String title = "Мэрия объявила о переносе ярмарки на выходные";
        NewsItem item = TestItems.extracted("https://a.example/1", title, "", Category.MOSCOW)
                .withText("", title, TextOrigin.TITLE_FALLBACK);

        assertTrue(scorer.evaluate(item).accepted());
    }

    @Test
    void profilesMustCoverEveryTier() {
        Map<SourceTier, QualityProfile> partial = Map.of(SourceTier.STANDARD, new QualityProfile(200, 0.45, 25, 0.05));

        assertThrows(IllegalArgumentException.class, () -> QualityProfiles.of(partial));
        assertThrows(IllegalArgumentException.class, () -> new QualityProfile(200, 1.5, 25, 0.05));
    }
}
