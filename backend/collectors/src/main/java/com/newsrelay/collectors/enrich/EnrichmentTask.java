package com.newsrelay.collectors.enrich;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum EnrichmentTask {
    SUMMARY(1, 220),
    CLEANUP(2, 900),
    HASHTAGS(3, 120),
    CATEGORY_VERIFY(0, 16),
    TRANSLATION(0, 200);

    private final int degradeRank;
    private final int maxOutputTokens;

    EnrichmentTask(int degradeRank, int maxOutputTokens) {
        this.degradeRank = degradeRank;
        this.maxOutputTokens = maxOutputTokens;
    }

    public int degradeRank() {
        return degradeRank;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }

    public boolean degradable() {
        return degradeRank > 0;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<EnrichmentTask> degradationOrder() {
        return Arrays.stream(values())
                .filter(EnrichmentTask::degradable)
                .sorted((left, right) -> Integer.compare(left.degradeRank, right.degradeRank))
                .toList();
    }
}
