package com.newsrelay.service.config;

import java.time.Duration;

public record StorageSettings(String storeFile, String eventLogFile, String instanceLeaseFile, String stopLeaseFile, Duration instanceLeaseTtl) {
    public StorageSettings {
        storeFile = orDefault(storeFile, "newsrelay-store.json");
        eventLogFile = orDefault(eventLogFile, "events.jsonl");
        instanceLeaseFile = orDefault(instanceLeaseFile, "instance.lease");
        stopLeaseFile = orDefault(stopLeaseFile, "collection-stop.lease");
        instanceLeaseTtl = instanceLeaseTtl == null || instanceLeaseTtl.isNegative() || instanceLeaseTtl.isZero()
                ? Duration.ofMinutes(10)
                : instanceLeaseTtl;
    }

    public static StorageSettings defaults() {
        return new StorageSettings(null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
