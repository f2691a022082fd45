package com.newsrelay.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.PublishedConfidence;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndWritesIsoInstants() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();

        assertSame(first, JsonUtils.objectMapper());
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        String json = first.writeValueAsString(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z")));
        assertTrue(json.contains("\"createdAt\":\"2026-02-01T00:00:00Z\""));
        assertFalse(json.contains("optional"));
    }

    @Test
    void enumsUseLowercaseCodes() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertEquals("\"moscow_region\"", mapper.writeValueAsString(Category.MOSCOW_REGION));
        assertEquals(Category.MOSCOW_REGION, mapper.readValue("\"moscow_region\"", Category.class));
        assertEquals("\"surrogate\"", mapper.writeValueAsString(PublishedConfidence.SURROGATE));
        assertEquals(PublishedConfidence.HIGH, mapper.readValue("\"high\"", PublishedConfidence.class));
    }

    @Test
    void canonicalJsonSortsMapKeys() {
        Map<String, String> unordered = new LinkedHashMap<>();
        unordered.put("z", "1");
        unordered.put("a", "2");

        assertEquals("{\"a\":\"2\",\"z\":\"1\"}", JsonUtils.toCanonicalJson(unordered));
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
