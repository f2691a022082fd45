package com.newsrelay.collectors.config;

public record BudgetSettings(
        double dailyLimitUsd,
        double reserveUsd,
        long dailyTokenLimit,
        double inputRatePer1k,
        double outputRatePer1k
) {
    public BudgetSettings {
        if (dailyLimitUsd < 0 || reserveUsd < 0 || dailyTokenLimit < 0 || inputRatePer1k < 0 || outputRatePer1k < 0) {
            throw new IllegalArgumentException("budget settings must not be negative");
        }
    }

    public static BudgetSettings defaults() {
        return new BudgetSettings(4.0, 0.25, 0, 0.00014, 0.00028);
    }
}
