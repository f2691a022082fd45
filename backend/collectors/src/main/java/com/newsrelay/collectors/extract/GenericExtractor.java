package com.newsrelay.collectors.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

public final class GenericExtractor {
    static final int MIN_PARAGRAPH_CHARS = 40;
    private static final String CHROME = "script, style, noscript, nav, header, footer, aside, form, iframe, "
            + "[class*=sidebar], [class*=related], [class*=comment], [class*=recommend], [class*=share], [class*=banner]";
    private static final String BODY_CANDIDATES = "[itemprop=articleBody], article, main";

    private GenericExtractor() {
    }

    public static String extract(Document source) {
        Document document = source.clone();
        document.select(CHROME).remove();

        Element best = null;
        int bestScore = 0;
        for (Element candidate : document.select(BODY_CANDIDATES)) {
            int score = paragraphChars(candidate, false);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null) {
            for (Element candidate : document.select("div, section, td")) {
                int score = paragraphChars(candidate, true);
                if (score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }
        }
        if (best == null) {
            return "";
        }
        List<String> paragraphs = new ArrayList<>();
        for (Element paragraph : best.select("p")) {
            String text = paragraph.text().trim();
            if (text.length() >= MIN_PARAGRAPH_CHARS) {
                paragraphs.add(text);
            }
        }
        return String.join("\n", paragraphs);
    }

    private static int paragraphChars(Element container, boolean directOnly) {
        int total = 0;
        List<Element> paragraphs = directOnly ? container.children().stream().filter(child -> child.is("p")).toList() : container.select("p");
        for (Element paragraph : paragraphs) {
            int length = paragraph.text().length();
            if (length >= MIN_PARAGRAPH_CHARS) {
                total += length;
            }
        }
        return total;
    }
}
