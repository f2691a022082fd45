package com.newsrelay.core.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class HtmlUtils {
    private static final Document.OutputSettings NO_PRETTY_PRINT = new Document.OutputSettings().prettyPrint(false);

    private HtmlUtils() {
    }

    public static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings(NO_PRETTY_PRINT);
        document.select("script, style").remove();
        document.select("br").after("\\n");
        document.select("p, div, li, h1, h2, h3, h4, blockquote").before("\\n\\n");
        String withBreaks = document.body().html().replace("\\n", "\n");
        String stripped = Jsoup.clean(withBreaks, "", Safelist.none(), NO_PRETTY_PRINT);
        return TextNormalizer.collapseLines(Parser.unescapeEntities(stripped, false));
    }

    public static Optional<String> extractTitle(Document document) {
        Element ogTitle = document.selectFirst("meta[property=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            return Optional.of(TextNormalizer.collapseWhitespace(ogTitle.attr("content")));
        }
        String title = TextNormalizer.collapseWhitespace(document.title());
        if (!title.isEmpty()) {
            return Optional.of(title);
        }
        Element h1 = document.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            return Optional.of(TextNormalizer.collapseWhitespace(h1.text()));
        }
        return Optional.empty();
    }

    public static List<String> extractLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href").trim();
            if (isAllowedLink(href)) {
                links.add(href);
            }
        }
        return new ArrayList<>(links);
    }

    private static boolean isAllowedLink(String link) {
        String lowered = link.toLowerCase(Locale.ROOT);
        return lowered.startsWith("http://") || lowered.startsWith("https://");
    }
}
