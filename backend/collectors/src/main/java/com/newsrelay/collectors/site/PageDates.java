package com.newsrelay.collectors.site;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.collectors.source.DateParsing;
import com.newsrelay.core.model.PublishedConfidence;
import com.newsrelay.core.util.JsonUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public final class PageDates {
    private static final Logger LOGGER = Logger.getLogger(PageDates.class.getName());
    private static final List<String> META_SELECTORS = List.of(
            "meta[property=article:published_time]",
            "meta[name=article:published_time]",
            "meta[itemprop=datePublished]",
            "meta[name=pubdate]"
    );

    private PageDates() {
    }

    public static PageDate extract(Document document, String url) {
        for (String selector : META_SELECTORS) {
            Element meta = document.selectFirst(selector);
            if (meta != null) {
                Optional<Instant> parsed = DateParsing.parse(meta.attr("content"));
                if (parsed.isPresent()) {
                    return new PageDate(parsed.get(), PublishedConfidence.HIGH);
                }
            }
        }
        Element itemprop = document.selectFirst("[itemprop=datePublished][datetime]");
        if (itemprop != null) {
            Optional<Instant> parsed = DateParsing.parse(itemprop.attr("datetime"));
            if (parsed.isPresent()) {
                return new PageDate(parsed.get(), PublishedConfidence.HIGH);
            }
        }
        Optional<Instant> fromJsonLd = jsonLdDate(document);
        if (fromJsonLd.isPresent()) {
            return new PageDate(fromJsonLd.get(), PublishedConfidence.HIGH);
        }
        for (Element time : document.select("time[datetime]")) {
            Optional<Instant> parsed = DateParsing.parse(time.attr("datetime"));
            if (parsed.isPresent()) {
                return new PageDate(parsed.get(), PublishedConfidence.MEDIUM);
            }
        }
        return DateParsing.fromUrl(url)
                .map(instant -> new PageDate(instant, PublishedConfidence.LOW))
                .orElse(PageDate.UNKNOWN);
    }

    private static Optional<Instant> jsonLdDate(Document document) {
        for (Element script : document.select("script[type=application/ld+json]")) {
            try {
                JsonNode root = JsonUtils.objectMapper().readTree(script.data());
                Optional<Instant> found = findDatePublished(root);
                if (found.isPresent()) {
                    return found;
                }
            } catch (IOException e) {
                LOGGER.fine("Ignoring malformed JSON-LD block: " + e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> findDatePublished(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                Optional<Instant> found = findDatePublished(child);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (!node.isObject()) {
            return Optional.empty();
        }
        JsonNode date = node.get("datePublished");
        if (date != null && date.isTextual()) {
            Optional<Instant> parsed = DateParsing.parse(date.asText());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return findDatePublished(node.get("@graph"));
    }
}
