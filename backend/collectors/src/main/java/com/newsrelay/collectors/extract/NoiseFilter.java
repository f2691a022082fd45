package com.newsrelay.collectors.extract;

import com.newsrelay.collectors.quality.NoisePhrases;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public final class NoiseFilter {
    private static final List<String> NAVIGATION_MARKERS = List.of(
            "выберите город", "истории эфир", "новости чтиво", "все новости", "главные новости",
            "cookie", "javascript", "©"
    );

    private NoiseFilter() {
    }

    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .filter(line -> !NoisePhrases.isNoiseLine(line))
                .filter(line -> !isNavigation(line))
                .filter(line -> !looksLikeNameList(line))
                .collect(Collectors.joining("\n"));
    }

    static boolean isNavigation(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.length() > 160) {
            return false;
        }
        for (String marker : NAVIGATION_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    static boolean looksLikeNameList(String line) {
        String[] words = line.split("\\s+");
        if (words.length <= 5 || line.endsWith(".")) {
            return false;
        }
        int capitalised = 0;
        for (String word : words) {
            if (!word.isEmpty() && Character.isUpperCase(word.codePointAt(0))) {
                capitalised++;
            }
        }
        return capitalised / (double) words.length > 0.7;
    }
}
