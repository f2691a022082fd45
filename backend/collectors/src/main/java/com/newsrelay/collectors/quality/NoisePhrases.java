package com.newsrelay.collectors.quality;

import java.util.List;
import java.util.Locale;

public final class NoisePhrases {
    public static final List<String> PHRASES = List.of(
            "подпис", "реклам", "telegram", "t.me", "vk.com", "ok.ru", "youtube",
            "читайте также", "смотрите также", "подробнее", "партнер",
            "поделиться", "войти", "зарегистр", "новости партнеров",
            "материалы по теме", "похожие материалы", "нашли опечатку",
            "что думаешь", "комментируй", "картина дня",
            "read more", "read also", "subscribe", "sign up", "share this", "advertisement", "related articles"
    );

    public static final List<String> LINE_MARKERS = List.of(
            "читайте также", "смотрите также", "подписывайтесь", "подпишитесь", "новости партнеров",
            "материалы по теме", "похожие материалы", "нашли опечатку", "реклама", "поделиться",
            "read also", "read more", "subscribe to", "share this", "advertisement", "related articles"
    );

    private NoisePhrases() {
    }

    public static int countIn(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String phrase : PHRASES) {
            if (lower.contains(phrase)) {
                hits++;
            }
        }
        return hits;
    }

    public static boolean isNoiseLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT).trim();
        if (lower.length() > 120) {
            return false;
        }
        for (String marker : LINE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
