package com.newsrelay.collectors.enrich;

public enum BudgetDecision {
    ALLOWED,
    DEGRADED,
    EXCEEDED;

    public boolean allowed() {
        return this == ALLOWED;
    }
}
