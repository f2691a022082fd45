package com.newsrelay.collectors.enrich;

import com.newsrelay.core.model.BudgetLedger;

import java.util.Set;

public record BudgetState(Status status, Set<EnrichmentTask> disabledTasks, BudgetLedger ledger, double limitUsd, double reserveUsd) {
    public BudgetState {
        disabledTasks = disabledTasks == null ? Set.of() : Set.copyOf(disabledTasks);
    }

    public enum Status {
        OK,
        DEGRADED,
        EXCEEDED
    }
}
