package com.newsrelay.collectors.enrich;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.EnrichmentDegraded;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class CallGate {
    private static final Logger LOGGER = Logger.getLogger(CallGate.class.getName());

    private final int maxCalls;
    private final EventBus eventBus;
    private final Clock clock;
    private final Set<EnrichmentTask> disabled = EnumSet.noneOf(EnrichmentTask.class);
    private String cycleId = "";
    private int calls;

    public CallGate(int maxCalls, EventBus eventBus, Clock clock) {
        this.maxCalls = maxCalls;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public synchronized void beginCycle(String nextCycleId) {
        if (nextCycleId != null && nextCycleId.equals(cycleId)) {
            return;
        }
        cycleId = nextCycleId == null ? "" : nextCycleId;
        calls = 0;
        disabled.clear();
    }

    public synchronized boolean tryAcquire(EnrichmentTask task) {
        if (maxCalls <= 0) {
            return true;
        }
        if (disabled.contains(task)) {
            return false;
        }
        if (calls < maxCalls) {
            calls++;
            return true;
        }
        List<EnrichmentTask> order = EnrichmentTask.degradationOrder();
        for (EnrichmentTask candidate : order) {
            if (disabled.add(candidate)) {
                LOGGER.info("Call cap " + maxCalls + " reached in cycle " + cycleId + ", disabling " + candidate.code());
                if (eventBus != null) {
                    eventBus.publish(new EnrichmentDegraded(clock.instant(), candidate.code(), "call_gate"));
                }
                break;
            }
        }
        return false;
    }

    public synchronized int callsThisCycle() {
        return calls;
    }

    public synchronized Set<EnrichmentTask> disabledTasks() {
        return EnumSet.copyOf(disabled);
    }
}
