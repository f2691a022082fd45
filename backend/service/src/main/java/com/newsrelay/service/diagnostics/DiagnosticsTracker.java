package com.newsrelay.service.diagnostics;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.CollectorTickCompleted;
import com.newsrelay.core.events.CollectorTickStarted;
import com.newsrelay.core.events.DeliveryFailed;
import com.newsrelay.core.events.EnrichmentDegraded;
import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.ItemAccepted;
import com.newsrelay.core.events.ItemDelivered;
import com.newsrelay.core.events.ItemRejected;
import com.newsrelay.core.events.SourceFetched;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsTotal = new LongAdder();
    private final LongAdder acceptedTotal = new LongAdder();
    private final LongAdder deliveredTotal = new LongAdder();
    private final LongAdder replayedTotal = new LongAdder();
    private final LongAdder deliveryFailuresTotal = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> dropsByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> degradedFeatures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribe(Event.class, this::onAnyEvent);
        eventBus.subscribe(ItemAccepted.class, event -> acceptedTotal.increment());
        eventBus.subscribe(ItemRejected.class, this::onRejected);
        eventBus.subscribe(SourceFetched.class, this::onSourceFetched);
        eventBus.subscribe(ItemDelivered.class, this::onDelivered);
        eventBus.subscribe(DeliveryFailed.class, event -> deliveryFailuresTotal.increment());
        eventBus.subscribe(EnrichmentDegraded.class, event -> degradedFeatures.put(event.feature(), event.reason()));
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public long acceptedTotal() {
        return acceptedTotal.longValue();
    }

    public long dropCount(String reason) {
        LongAdder count = dropsByReason.get(reason);
        return count == null ? 0 : count.longValue();
    }

    public Map<String, Long> dropsByReason() {
        Map<String, Long> drops = new TreeMap<>();
        dropsByReason.forEach((reason, count) -> drops.put(reason, count.longValue()));
        return drops;
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsTotal", eventsTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("acceptedTotal", acceptedTotal.longValue());
        metrics.put("drops", dropsByReason());
        metrics.put("deliveredTotal", deliveredTotal.longValue());
        metrics.put("replayedTotal", replayedTotal.longValue());
        metrics.put("deliveryFailuresTotal", deliveryFailuresTotal.longValue());
        metrics.put("degradedFeatures", new TreeMap<>(degradedFeatures));
        metrics.put("sources", sourcesSnapshot());
        metrics.put("collectors", collectorsSnapshot());
        return metrics;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new TreeMap<>();
        sourceStatuses.forEach((name, status) -> sources.put(name, status.toMap()));
        return sources;
    }

    public Map<String, Object> collectorsSnapshot() {
        Map<String, Object> collectors = new HashMap<>();
        for (Map.Entry<String, CollectorStatus> entry : collectorStatuses.entrySet()) {
            collectors.put(entry.getKey(), entry.getValue().toMap());
        }
        return collectors;
    }

    private void onAnyEvent(Event event) {
        eventsTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private void onRejected(ItemRejected event) {
        dropsByReason.computeIfAbsent(event.reason(), ignored -> new LongAdder()).increment();
    }

    private void onDelivered(ItemDelivered event) {
        deliveredTotal.increment();
        if (event.replay()) {
            replayedTotal.increment();
        }
    }

    private void onSourceFetched(SourceFetched event) {
        sourceStatuses.compute(event.source(), (name, current) -> {
            long failures = current == null ? 0 : current.failureCount();
            return new SourceStatus(
                    event.timestamp(),
                    event.status(),
                    event.errorCode(),
                    event.itemCount(),
                    event.durationMillis(),
                    event.errorCode() == null ? failures : failures + 1
            );
        });
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty()) {
            Instant first = recentEventTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentEventTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onTickStarted(CollectorTickStarted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastRunAt(event.timestamp());
        });
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withCompletion(event.timestamp(), event.durationMillis(), event.success(), event.itemCount());
        });
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"collector".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        collectorStatuses.compute(collectorName, (name, current) -> {
            CollectorStatus status = current == null ? CollectorStatus.empty() : current;
            return status.withLastErrorMessage(event.message());
        });
    }

    private record SourceStatus(
            Instant lastFetchAt,
            String lastStatus,
            String lastErrorCode,
            int lastItemCount,
            long lastDurationMillis,
            long failureCount
    ) {
        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastFetchAt", lastFetchAt.toString());
            map.put("lastStatus", lastStatus);
            map.put("lastErrorCode", lastErrorCode);
            map.put("lastItemCount", lastItemCount);
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("failureCount", failureCount);
            return map;
        }
    }

    private record CollectorStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            Integer lastItemCount,
            String lastErrorMessage
    ) {
        private static CollectorStatus empty() {
            return new CollectorStatus(null, null, null, null, null);
        }

        private CollectorStatus withLastRunAt(Instant runAt) {
            return new CollectorStatus(runAt, lastDurationMillis, lastSuccess, lastItemCount, lastErrorMessage);
        }

        private CollectorStatus withCompletion(Instant runAt, long durationMillis, boolean success, int itemCount) {
            return new CollectorStatus(runAt, durationMillis, success, itemCount, success ? null : lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(String message) {
            return new CollectorStatus(lastRunAt, lastDurationMillis, lastSuccess, lastItemCount, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastItemCount", lastItemCount);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
