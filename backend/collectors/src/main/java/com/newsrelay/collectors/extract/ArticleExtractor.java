package com.newsrelay.collectors.extract;

import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.quality.ContentQualityScorer;
import com.newsrelay.collectors.quality.QualityProfile;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceType;
import com.newsrelay.core.model.TextOrigin;
import com.newsrelay.core.util.HashingUtils;
import com.newsrelay.core.util.HtmlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

public class ArticleExtractor {
    private static final Logger LOGGER = Logger.getLogger(ArticleExtractor.class.getName());

    private final ContentQualityScorer scorer;
    private final EnrichmentGateway gateway;

    public ArticleExtractor(ContentQualityScorer scorer, EnrichmentGateway gateway) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.gateway = gateway;
    }

    public NewsItem extract(NewsItem candidate) {
        String payload = candidate.payload() == null ? "" : candidate.payload();
        if (candidate.sourceType() == SourceType.HTML) {
            return extractPage(candidate, payload);
        }
        String raw = HtmlUtils.toPlainText(payload);
        String clean = NoiseFilter.clean(raw);
        if (clean.isBlank()) {
            return titleFallback(candidate, raw);
        }
        return candidate.withText(raw, clean, TextOrigin.FEED);
    }

    private NewsItem extractPage(NewsItem candidate, String html) {
        if (html.isBlank()) {
            return titleFallback(candidate, "");
        }
        Document document = Jsoup.parse(html, candidate.url());
        TextOrigin origin = TextOrigin.SITE_RULE;
        String raw = SiteExtractionRules.extract(document, candidate.url());
        if (raw.isBlank()) {
            origin = TextOrigin.GENERIC;
            raw = GenericExtractor.extract(document);
        }
        String clean = NoiseFilter.clean(raw);

        if (isThin(candidate, clean) && gateway != null && gateway.enabled(EnrichmentTask.CLEANUP)) {
            String pageText = HtmlUtils.toPlainText(document.body() == null ? "" : document.body().html());
            if (!pageText.isBlank()) {
                Optional<String> cleaned = gateway.cleanup(HashingUtils.sha256(pageText), pageText)
                        .map(NoiseFilter::clean)
                        .filter(text -> text.length() > clean.length());
                if (cleaned.isPresent()) {
                    LOGGER.fine("AI cleanup replaced " + clean.length() + " chars with " + cleaned.get().length() + " for " + candidate.url());
                    return candidate.withText(raw.isBlank() ? pageText : raw, cleaned.get(), TextOrigin.AI_CLEANUP);
                }
            }
        }
        if (clean.isBlank()) {
            return titleFallback(candidate, raw);
        }
        return candidate.withText(raw, clean, origin);
    }

    private boolean isThin(NewsItem candidate, String text) {
        QualityProfile profile = scorer.profileFor(candidate);
        return text.length() < profile.minLength() || ContentQualityScorer.score(text) < profile.threshold();
    }

    private static NewsItem titleFallback(NewsItem candidate, String raw) {
        return candidate.withText(raw, candidate.title(), TextOrigin.TITLE_FALLBACK);
    }
}
