package com.newsrelay.core.model;

import java.time.LocalDate;
import java.util.Objects;

public record BudgetLedger(
        LocalDate day,
        long tokensIn,
        long tokensOut,
        double costUsd,
        long calls,
        long cacheHits
) {
    public BudgetLedger {
        Objects.requireNonNull(day, "day is required");
    }

    public static BudgetLedger empty(LocalDate day) {
        return new BudgetLedger(day, 0, 0, 0.0, 0, 0);
    }

    public BudgetLedger plusCall(long addedTokensIn, long addedTokensOut, double addedCost) {
        return new BudgetLedger(
                day,
                tokensIn + Math.max(0, addedTokensIn),
                tokensOut + Math.max(0, addedTokensOut),
                costUsd + Math.max(0.0, addedCost),
                calls + 1,
                cacheHits
        );
    }

    public BudgetLedger plusCacheHit() {
        return new BudgetLedger(day, tokensIn, tokensOut, costUsd, calls, cacheHits + 1);
    }

    public long totalTokens() {
        return tokensIn + tokensOut;
    }
}
