package com.newsrelay.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextNormalizer {
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?…])\\s+");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern ANY_SPACE = Pattern.compile("\\s+");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "into", "are", "was", "has", "have", "its", "after",
            "над", "под", "для", "как", "что", "это", "его", "она", "они", "при", "или", "про", "без", "уже", "был",
            "была", "были", "так", "все", "еще", "где", "чем", "после", "из-за"
    );

    private TextNormalizer() {
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return ANY_SPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String collapseLines(String text) {
        if (text == null) {
            return "";
        }
        return text.lines()
                .map(line -> HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim())
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT).replace('ё', 'е');
        List<String> words = new ArrayList<>();
        for (String token : WORD_SEPARATOR.split(lowered)) {
            if (token.length() >= 2) {
                words.add(token);
            }
        }
        return words;
    }

    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_BOUNDARY.split(text.trim()))
                .map(String::trim)
                .filter(sentence -> !sentence.isEmpty())
                .toList();
    }

    public static Set<String> titleWords(String title) {
        Set<String> significant = new LinkedHashSet<>();
        for (String word : words(title)) {
            if (word.length() >= 3 && !STOP_WORDS.contains(word)) {
                significant.add(word);
            }
        }
        return significant;
    }

    public static String normalizeTitle(String title) {
        return String.join(" ", titleWords(title));
    }

    public static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    public static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars);
    }
}
