package com.newsrelay.collectors.quality;

public record QualityProfile(int minLength, double threshold, int fallbackMinLength, double fallbackThreshold) {
    public QualityProfile {
        if (minLength < 0 || fallbackMinLength < 0) {
            throw new IllegalArgumentException("minimum lengths must not be negative");
        }
        if (!inUnitRange(threshold) || !inUnitRange(fallbackThreshold)) {
            throw new IllegalArgumentException("thresholds must be within [0, 1]");
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
