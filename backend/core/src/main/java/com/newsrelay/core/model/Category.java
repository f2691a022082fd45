package com.newsrelay.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Category {
    WORLD("world"),
    RUSSIA("russia"),
    MOSCOW("moscow"),
    MOSCOW_REGION("moscow_region");

    private final String code;

    Category(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Category fromCode(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }

    public static Optional<Category> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Category category : values()) {
            if (category.code.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
