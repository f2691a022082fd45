package com.newsrelay.collectors.classify;

import com.newsrelay.core.model.Category;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CategoryClassifier {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<String> MOSCOW_REGION_URL_MARKERS = List.of(
            "moskovskaya-oblast", "moskovskaja-oblast", "podmoskovie", "mosobl", "mosreg", "regions.ru",
            "360.ru/rubriki/mosobl"
    );
    private static final List<String> MOSCOW_URL_MARKERS = List.of(
            "/moscow/", "/moskva/", "-moskvy-", "-moskve-", "-moscow-"
    );

    private static final Map<Category, List<Pattern>> PATTERNS = new EnumMap<>(Map.of(
            Category.MOSCOW, compile(
                    "\\bмоскв(а|е|у|ы|ой)\\b", "\\bстолиц(а|е|у|ы)\\b", "\\bсобянин", "\\bкремл(ь|я|е)\\b",
                    "\\bкрасн(ая|ой|ую) площад", "\\bстолич", "\\bmoscow\\b(?! region| oblast)", "\\bsobyanin\\b"
            ),
            Category.MOSCOW_REGION, compile(
                    "\\bподмосковь(е|я|ю)\\b", "\\bмосковск(ая|ой|ую) област", "\\bмособласт", "\\bмосрег",
                    "\\bодинцов", "\\bхимк", "\\bкорол(е|ё)в", "\\bбалаших", "\\bлюберц", "\\bмытищ", "\\bподольск",
                    "\\bжуковск", "\\bногинск", "\\bщ(е|ё)лков", "\\bсерпухов", "\\bколомн", "\\bэлектросталь",
                    "\\bреутов", "\\bкрасногорск", "\\bдолгопрудн", "\\bдомодедов", "\\bсолнечногорск", "\\bворобь(е|ё)в\\b",
                    "\\bmoscow (region|oblast)\\b", "\\bpodmoskovye\\b"
            ),
            Category.WORLD, compile(
                    "\\bсша\\b", "\\bамерик", "\\bтрамп", "\\bевроп(а|е|ы|у)\\b", "\\bевросоюз", "\\bнато\\b",
                    "\\bукраин", "\\bкиев", "\\bкита(й|я|е)", "\\bпекин", "\\bяпони", "\\bиран", "\\bизраил",
                    "\\bсири(я|и)\\b", "\\bтурци(я|и)\\b", "\\bгермани", "\\bберлин", "\\bфранци", "\\bпариж",
                    "\\bбритани", "\\bлондон", "\\bпольш", "\\bоон\\b", "\\bбелорусси", "\\bказахстан",
                    "\\bиндия\\b", "\\bбразили", "\\bканад", "\\busa\\b", "\\bunited states\\b", "\\bchina\\b",
                    "\\beurope(an)?\\b", "\\bnato\\b", "\\bukrain", "\\bgerman", "\\bfrance\\b", "\\bbritain\\b"
            )
    ));

    public CategoryDecision classify(String title, String text, String url, Category fallback) {
        Category byUrl = classifyUrl(url);
        if (byUrl != null) {
            return new CategoryDecision(byUrl, false);
        }
        String content = (title + " " + title + " " + (text == null ? "" : text)).toLowerCase(Locale.ROOT);
        Map<Category, Integer> scores = new EnumMap<>(Category.class);
        for (Map.Entry<Category, List<Pattern>> entry : PATTERNS.entrySet()) {
            int score = 0;
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(content);
                while (matcher.find()) {
                    score++;
                }
            }
            if (score > 0) {
                scores.put(entry.getKey(), score);
            }
        }
        if (scores.isEmpty()) {
            return new CategoryDecision(fallback, true);
        }
        int moscow = scores.getOrDefault(Category.MOSCOW, 0);
        int region = scores.getOrDefault(Category.MOSCOW_REGION, 0);
        if (moscow > 0 && region > 0) {
            return new CategoryDecision(region >= moscow ? Category.MOSCOW_REGION : Category.MOSCOW, false);
        }
        int world = scores.getOrDefault(Category.WORLD, 0);
        int bestOther = Math.max(moscow, region);
        if (world > 0) {
            return new CategoryDecision(world * 1.5 > bestOther ? Category.WORLD : bestCategory(moscow, region), false);
        }
        return new CategoryDecision(bestCategory(moscow, region), false);
    }

    static Category classifyUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String marker : MOSCOW_REGION_URL_MARKERS) {
            if (lower.contains(marker)) {
                return Category.MOSCOW_REGION;
            }
        }
        for (String marker : MOSCOW_URL_MARKERS) {
            if (lower.contains(marker)) {
                return Category.MOSCOW;
            }
        }
        return null;
    }

    private static Category bestCategory(int moscow, int region) {
        return region > moscow ? Category.MOSCOW_REGION : Category.MOSCOW;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(regex -> Pattern.compile(regex, FLAGS)).toList();
    }
}
