package com.newsrelay.collectors.enrich;

import java.util.concurrent.atomic.AtomicBoolean;

public final class BudgetReservation {
    private final BudgetDecision decision;
    private final long tokens;
    private final double costUsd;
    private final AtomicBoolean released = new AtomicBoolean();

    BudgetReservation(BudgetDecision decision, long tokens, double costUsd) {
        this.decision = decision;
        this.tokens = tokens;
        this.costUsd = costUsd;
    }

    static BudgetReservation refused(BudgetDecision decision) {
        BudgetReservation reservation = new BudgetReservation(decision, 0, 0.0);
        reservation.released.set(true);
        return reservation;
    }

    public BudgetDecision decision() {
        return decision;
    }

    public boolean allowed() {
        return decision.allowed();
    }

    long tokens() {
        return tokens;
    }

    double costUsd() {
        return costUsd;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
