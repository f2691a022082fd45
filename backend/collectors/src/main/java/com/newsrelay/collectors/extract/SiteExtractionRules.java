package com.newsrelay.collectors.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class SiteExtractionRules {
    private static final Map<String, String> SELECTORS = Map.of(
            "ria.ru", "div.article__body div.article__text",
            "tass.ru", "div.text-content p, article p",
            "lenta.ru", "div.topic-body__content p.topic-body__content-text, div.topic-body__content p",
            "rbc.ru", "div.article__text p",
            "interfax.ru", "article[itemprop=articleBody] p",
            "kommersant.ru", "div.doc__body p.doc__text, p.doc__text",
            "iz.ru", "div.text-article p, div[itemprop=articleBody] p",
            "mosregtoday.ru", "div.article-body p",
            "360.ru", "div.article-body p, div.content-block p"
    );

    private SiteExtractionRules() {
    }

    public static Optional<String> selectorFor(String url) {
        String host = host(url);
        if (host == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : SELECTORS.entrySet()) {
            String known = entry.getKey();
            if (host.equals(known) || host.endsWith("." + known)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public static String extract(Document document, String url) {
        Optional<String> selector = selectorFor(url);
        if (selector.isEmpty()) {
            return "";
        }
        Elements blocks = document.select(selector.get());
        List<String> lines = new ArrayList<>();
        for (Element block : blocks) {
            String text = block.text().trim();
            if (!text.isEmpty() && !lines.contains(text)) {
                lines.add(text);
            }
        }
        return String.join("\n", lines);
    }

    private static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return null;
            }
            String lowered = host.toLowerCase(Locale.ROOT);
            return lowered.startsWith("www.") ? lowered.substring(4) : lowered;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
