package com.newsrelay.collectors.enrich;

public enum EnrichmentStatus {
    OK,
    CACHE_HIT,
    DISABLED,
    BUDGET_EXCEEDED,
    GATE_CLOSED,
    STOPPED,
    FAILED;

    public boolean hasResponse() {
        return this == OK || this == CACHE_HIT;
    }
}
