package com.newsrelay.collectors.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.core.util.TextNormalizer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public class HashtagClassifier {
    private static final Logger LOGGER = Logger.getLogger(HashtagClassifier.class.getName());
    private static final int AI_TEXT_CHARS = 1500;

    private final EnrichmentGateway gateway;

    public HashtagClassifier(EnrichmentGateway gateway) {
        this.gateway = gateway;
    }

    public List<String> classify(NewsItem item, Category category) {
        String text = item.title() + "\n" + (item.cleanText() == null ? "" : item.cleanText());
        if (category == Category.WORLD) {
            String rubric = HashtagTaxonomy.findRubric(text)
                    .or(() -> escalate(item, HashtagTaxonomy.WORLD, null, null).map(AiTags::r0))
                    .orElse(HashtagTaxonomy.DEFAULT_RUBRIC);
            return List.of(HashtagTaxonomy.WORLD, rubric);
        }

        HashtagTaxonomy.Region region = resolveRegion(text, category).orElse(null);
        String cityTag = null;
        if (region != null) {
            cityTag = HashtagTaxonomy.findCityIn(text, region.tag())
                    .map(HashtagTaxonomy.City::tag)
                    .orElse(region.capitalTag());
        }
        Optional<String> rubric = HashtagTaxonomy.findRubric(text);

        String districtTag = region == null ? null : region.district().tag();
        String regionTag = region == null ? null : region.tag();
        String rubricTag = rubric.orElse(null);
        if (region == null || rubric.isEmpty()) {
            Optional<AiTags> ai = escalate(item, HashtagTaxonomy.RUSSIA, regionTag, rubricTag);
            if (ai.isPresent()) {
                AiTags tags = ai.get();
                if (region == null && tags.g2() != null) {
                    districtTag = tags.g1();
                    regionTag = tags.g2();
                    cityTag = tags.g3() != null
                            ? tags.g3()
                            : HashtagTaxonomy.region(tags.g2()).map(HashtagTaxonomy.Region::capitalTag).orElse(null);
                } else if (region == null && tags.g1() != null) {
                    districtTag = tags.g1();
                }
                if (rubricTag == null) {
                    rubricTag = tags.r0();
                }
            }
        }
        return ordered(HashtagTaxonomy.RUSSIA, districtTag, regionTag, cityTag,
                rubricTag == null ? HashtagTaxonomy.DEFAULT_RUBRIC : rubricTag);
    }

    static List<String> ordered(String g0, String g1, String g2, String g3, String r0) {
        List<String> tags = new ArrayList<>(5);
        tags.add(g0);
        if (g1 != null) {
            tags.add(g1);
            if (g2 != null) {
                tags.add(g2);
                if (g3 != null && !g3.equals(g2)) {
                    tags.add(g3);
                }
            }
        }
        tags.add(r0);
        return List.copyOf(tags);
    }

    private static Optional<HashtagTaxonomy.Region> resolveRegion(String text, Category category) {
        if (category == Category.MOSCOW) {
            return HashtagTaxonomy.region("#Moscow");
        }
        if (category == Category.MOSCOW_REGION) {
            return HashtagTaxonomy.region("#MoscowOblast");
        }
        Optional<HashtagTaxonomy.Region> region = HashtagTaxonomy.findRegion(text);
        if (region.isPresent()) {
            return region;
        }
        return HashtagTaxonomy.findCity(text).flatMap(city -> HashtagTaxonomy.region(city.regionTag()));
    }

    private Optional<AiTags> escalate(NewsItem item, String g0, String resolvedRegion, String resolvedRubric) {
        if (gateway == null || !gateway.enabled(EnrichmentTask.HASHTAGS)) {
            return Optional.empty();
        }
        Map<String, Object> params = new HashMap<>();
        params.put("g0", g0);
        if (resolvedRegion != null) {
            params.put("g2", resolvedRegion);
        }
        if (resolvedRubric != null) {
            params.put("r0", resolvedRubric);
        }
        if (HashtagTaxonomy.RUSSIA.equals(g0)) {
            params.put("allowedG1", String.join(",", HashtagTaxonomy.districtTags()));
            params.put("allowedG2", String.join(",", HashtagTaxonomy.regionTags()));
            params.put("allowedG3", String.join(",", HashtagTaxonomy.cityTags()));
        }
        params.put("allowedR0", String.join(",", HashtagTaxonomy.rubricTags()));
        String payload = item.title() + "\n\n" + TextNormalizer.truncate(item.cleanText() == null ? "" : item.cleanText(), AI_TEXT_CHARS);
        return gateway.classifyHashtags(item.checksum(), payload, params)
                .flatMap(HashtagClassifier::parseAiTags)
                .filter(tags -> HashtagTaxonomy.RUSSIA.equals(g0) || (tags.g1() == null && tags.g2() == null && tags.g3() == null));
    }

    static Optional<AiTags> parseAiTags(String answer) {
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(answer.substring(start, end + 1));
        } catch (IOException e) {
            LOGGER.fine("Unreadable hashtag answer: " + e.getMessage());
            return Optional.empty();
        }
        String g1 = tagField(root, "g1");
        String g2 = tagField(root, "g2");
        String g3 = tagField(root, "g3");
        String r0 = tagField(root, "r0");

        if (r0 != null && !HashtagTaxonomy.isRubric(r0)) {
            return rejected("r0", r0);
        }
        Optional<HashtagTaxonomy.FederalDistrict> district = g1 == null ? Optional.empty() : HashtagTaxonomy.district(g1);
        if (g1 != null && district.isEmpty()) {
            return rejected("g1", g1);
        }
        Optional<HashtagTaxonomy.Region> region = g2 == null ? Optional.empty() : HashtagTaxonomy.region(g2);
        if (g2 != null && region.isEmpty()) {
            return rejected("g2", g2);
        }
        Optional<HashtagTaxonomy.City> city = g3 == null ? Optional.empty() : HashtagTaxonomy.city(g3);
        if (g3 != null && city.isEmpty()) {
            return rejected("g3", g3);
        }
        if (region.isPresent()) {
            if (district.isPresent() && district.get() != region.get().district()) {
                return rejected("g1/g2", g1 + "/" + g2);
            }
            g1 = region.get().district().tag();
        }
        if (city.isPresent()) {
            if (region.isPresent() && !city.get().regionTag().equals(g2)) {
                return rejected("g2/g3", g2 + "/" + g3);
            }
            if (region.isEmpty()) {
                return rejected("g3", g3 + " without region");
            }
        }
        return Optional.of(new AiTags(g1, g2, g3, r0));
    }

    private static Optional<AiTags> rejected(String field, String value) {
        LOGGER.info("Discarding AI hashtags: " + field + " value " + value + " is not allowed");
        return Optional.empty();
    }

    private static String tagField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            return null;
        }
        String value = node.asText().trim().replace(" ", "");
        if (value.isEmpty()) {
            return null;
        }
        return value.startsWith("#") ? value : "#" + value;
    }

    record AiTags(String g1, String g2, String g3, String r0) {
    }
}
