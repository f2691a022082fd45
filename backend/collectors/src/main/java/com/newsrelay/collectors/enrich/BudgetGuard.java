package com.newsrelay.collectors.enrich;

import com.newsrelay.collectors.config.BudgetSettings;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.EnrichmentDegraded;
import com.newsrelay.core.model.BudgetLedger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

public class BudgetGuard {
    private static final Logger LOGGER = Logger.getLogger(BudgetGuard.class.getName());

    private final BudgetSettings settings;
    private final EnrichmentStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final Set<String> announced = new HashSet<>();
    private final Object reservationLock = new Object();
    private long reservedTokens;
    private double reservedCostUsd;

    public BudgetGuard(BudgetSettings settings, EnrichmentStore store, EventBus eventBus, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public boolean budgetOk(EnrichmentTask task) {
        return check(task, 0).allowed();
    }

    public BudgetDecision check(EnrichmentTask task, long estimatedTokens) {
        synchronized (reservationLock) {
            return decide(task, estimatedTokens);
        }
    }

    public BudgetReservation reserve(EnrichmentTask task, long estimatedTokens) {
        synchronized (reservationLock) {
            BudgetDecision decision = decide(task, estimatedTokens);
            if (!decision.allowed()) {
                return BudgetReservation.refused(decision);
            }
            long tokens = Math.max(0, estimatedTokens);
            double cost = estimatedCost(estimatedTokens, task.maxOutputTokens());
            reservedTokens += tokens;
            reservedCostUsd += cost;
            return new BudgetReservation(decision, tokens, cost);
        }
    }

    public void release(BudgetReservation reservation) {
        if (!reservation.markReleased()) {
            return;
        }
        synchronized (reservationLock) {
            reservedTokens = Math.max(0, reservedTokens - reservation.tokens());
            reservedCostUsd = Math.max(0.0, reservedCostUsd - reservation.costUsd());
        }
    }

    private BudgetDecision decide(EnrichmentTask task, long estimatedTokens) {
        BudgetLedger ledger = store.ledger(today());
        double committed = ledger.costUsd() + reservedCostUsd;
        if (exceeded(committed, ledger.totalTokens() + reservedTokens, estimatedTokens,
                estimatedCost(estimatedTokens, task.maxOutputTokens()))) {
            announce(ledger.day(), null, "budget_exceeded");
            return BudgetDecision.EXCEEDED;
        }
        if (task.degradable() && committed >= degradeThreshold(task)) {
            announce(ledger.day(), task, "budget_reserve");
            return BudgetDecision.DEGRADED;
        }
        return BudgetDecision.ALLOWED;
    }

    public void record(LlmResponse response) {
        double cost = cost(response.inputTokens(), response.outputTokens());
        store.recordUsage(today(), ledger -> ledger.plusCall(response.inputTokens(), response.outputTokens(), cost));
    }

    public void recordCacheHit() {
        store.recordUsage(today(), BudgetLedger::plusCacheHit);
    }

    public BudgetState state() {
        BudgetLedger ledger = store.ledger(today());
        if (exceeded(ledger.costUsd(), ledger.totalTokens(), 0, 0.0)) {
            return new BudgetState(BudgetState.Status.EXCEEDED, EnumSet.allOf(EnrichmentTask.class), ledger,
                    settings.dailyLimitUsd(), settings.reserveUsd());
        }
        Set<EnrichmentTask> disabled = EnumSet.noneOf(EnrichmentTask.class);
        for (EnrichmentTask task : EnrichmentTask.degradationOrder()) {
            if (ledger.costUsd() >= degradeThreshold(task)) {
                disabled.add(task);
            }
        }
        BudgetState.Status status = disabled.isEmpty() ? BudgetState.Status.OK : BudgetState.Status.DEGRADED;
        return new BudgetState(status, disabled, ledger, settings.dailyLimitUsd(), settings.reserveUsd());
    }

    public double cost(long inputTokens, long outputTokens) {
        return inputTokens / 1000.0 * settings.inputRatePer1k() + outputTokens / 1000.0 * settings.outputRatePer1k();
    }

    private double estimatedCost(long inputTokens, long outputTokens) {
        return inputTokens <= 0 ? 0.0 : cost(inputTokens, outputTokens);
    }

    private boolean exceeded(double spentUsd, long spentTokens, long estimatedTokens, double estimatedCost) {
        if (spentUsd + estimatedCost >= settings.dailyLimitUsd()) {
            return true;
        }
        return settings.dailyTokenLimit() > 0
                && spentTokens + Math.max(0, estimatedTokens) >= settings.dailyTokenLimit();
    }

    // Degradable tasks switch off in rank order, spread across the reserve.
    private double degradeThreshold(EnrichmentTask task) {
        double soft = Math.max(0.0, settings.dailyLimitUsd() - settings.reserveUsd());
        return soft + (task.degradeRank() - 1) * settings.reserveUsd() / 3.0;
    }

    private void announce(LocalDate day, EnrichmentTask task, String reason) {
        String feature = task == null ? "all" : task.code();
        synchronized (announced) {
            if (!announced.add(day + "|" + feature)) {
                return;
            }
        }
        LOGGER.warning("Enrichment feature " + feature + " disabled for " + day + ": " + reason);
        eventBus.publish(new EnrichmentDegraded(clock.instant(), feature, reason));
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
