package com.newsrelay.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PublishedConfidence {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    SURROGATE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
