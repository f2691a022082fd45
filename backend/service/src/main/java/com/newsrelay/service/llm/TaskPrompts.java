package com.newsrelay.service.llm;

import com.newsrelay.collectors.enrich.EnrichmentTask;

import java.util.Map;

final class TaskPrompts {
    private TaskPrompts() {
    }

    static String system(EnrichmentTask task, Map<String, Object> params) {
        return switch (task) {
            case SUMMARY -> "You summarize news articles in Russian in at most " + param(params, "maxSentences", "3")
                    + " sentences. Neutral tone, no speculation, no clickbait. Keep facts, numbers, places and names."
                    + " If the source has few details, say so briefly.";
            case CLEANUP -> "You receive the raw text of a news web page. Return only the article body, one paragraph per line."
                    + " Drop navigation, advertising, related links, social buttons and comments. Do not rewrite sentences.";
            case HASHTAGS -> "You tag Russian news. Answer with a single JSON object with the keys g1 (federal district),"
                    + " g2 (region), g3 (city) and r0 (rubric). Use null for any level you cannot determine."
                    + " Geography scope is " + param(params, "g0", "#Russia") + "."
                    + allowed("g1", params.get("allowedG1"))
                    + allowed("g2", params.get("allowedG2"))
                    + allowed("g3", params.get("allowedG3"))
                    + allowed("r0", params.get("allowedR0"))
                    + known("g2", params.get("g2"))
                    + known("r0", params.get("r0"));
            case CATEGORY_VERIFY -> "You check the geographic category of a news item. Answer with exactly one of: "
                    + param(params, "allowed", "world,russia,moscow,moscow_region")
                    + ". The proposed category is " + param(params, "proposed", "russia") + ".";
            case TRANSLATION -> "Translate the text to " + param(params, "target", "ru")
                    + ". Return only the translation.";
        };
    }

    static String user(EnrichmentTask task, String payload, Map<String, Object> params) {
        if (task == EnrichmentTask.SUMMARY && params.get("title") != null) {
            return "Title: " + params.get("title") + "\n\nText: " + payload;
        }
        return payload;
    }

    private static String param(Map<String, Object> params, String key, String fallback) {
        Object value = params.get(key);
        return value == null ? fallback : value.toString();
    }

    private static String allowed(String key, Object values) {
        return values == null ? "" : " Allowed " + key + " values: " + values + ".";
    }

    private static String known(String key, Object value) {
        return value == null ? "" : " " + key + " is already known to be " + value + ".";
    }
}
