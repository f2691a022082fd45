package com.newsrelay.service.diagnostics;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.CollectorTickCompleted;
import com.newsrelay.core.events.CollectorTickStarted;
import com.newsrelay.core.events.DeliveryFailed;
import com.newsrelay.core.events.EnrichmentDegraded;
import com.newsrelay.core.events.ItemAccepted;
import com.newsrelay.core.events.ItemDelivered;
import com.newsrelay.core.events.ItemRejected;
import com.newsrelay.core.events.SourceFetched;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTrackerTest {
    private static final Instant AT = Instant.parse("2026-02-15T00:00:00Z");

    @Test
    void countsAcceptedItemsDropsAndDeliveries() {
        EventBus eventBus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected bus error", error);
        });
        DiagnosticsTracker tracker = new DiagnosticsTracker(eventBus, Clock.fixed(AT, ZoneOffset.UTC));

        eventBus.publish(new ItemAccepted(AT, 1, "tass", "russia", "https://tass.example/1"));
        eventBus.publish(new ItemRejected(AT, "tass", "https://tass.example/2", "LOW_QUALITY"));
        eventBus.publish(new ItemRejected(AT, "ria", "https://ria.example/3", "LOW_QUALITY"));
        eventBus.publish(new ItemRejected(AT, "ria", "https://ria.example/4", "DUPLICATE_URL"));
        eventBus.publish(new ItemDelivered(AT, "alice", 1, false));
        eventBus.publish(new ItemDelivered(AT, "bob", 1, true));
        eventBus.publish(new DeliveryFailed(AT, "carol", 1, "transport down"));
        eventBus.publish(new EnrichmentDegraded(AT, "SUMMARY", "budget soft limit"));

        assertEquals(1, tracker.acceptedTotal());
        assertEquals(2, tracker.dropCount("LOW_QUALITY"));
        assertEquals(0, tracker.dropCount("STALE"));
        assertEquals(Map.of("DUPLICATE_URL", 1L, "LOW_QUALITY", 2L), tracker.dropsByReason());

        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals(8L, metrics.get("eventsTotal"));
        assertEquals(8, metrics.get("recentEventsPerMinute"));
        assertEquals(2L, metrics.get("deliveredTotal"));
        assertEquals(1L, metrics.get("replayedTotal"));
        assertEquals(1L, metrics.get("deliveryFailuresTotal"));
        assertEquals(Map.of("SUMMARY", "budget soft limit"), metrics.get("degradedFeatures"));
    }

    @Test
    void tracksSourceFailuresAcrossFetches() {
        EventBus eventBus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(eventBus, Clock.fixed(AT, ZoneOffset.UTC));

        eventBus.publish(new SourceFetched(AT, "tass", "https://tass.example/rss", "ERROR", "HTTP_503", 0, 900));
        eventBus.publish(new SourceFetched(AT.plusSeconds(60), "tass", "https://tass.example/rss", "ERROR", "TIMEOUT", 0, 60000));
        eventBus.publish(new SourceFetched(AT.plusSeconds(120), "tass", "https://tass.example/rss", "OK", null, 12, 300));

        Map<?, ?> tass = (Map<?, ?>) tracker.sourcesSnapshot().get("tass");
        assertEquals("OK", tass.get("lastStatus"));
        assertEquals(12, tass.get("lastItemCount"));
        assertEquals(2L, tass.get("failureCount"));
        assertEquals(AT.plusSeconds(120).toString(), tass.get("lastFetchAt"));
    }

    @Test
    void tracksCollectorStatusFromTicksAndAlerts() {
        EventBus eventBus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(eventBus, Clock.fixed(AT, ZoneOffset.UTC));

        eventBus.publish(new CollectorTickStarted(AT, "newsCollector", "cycle-1"));
        eventBus.publish(new CollectorTickCompleted(AT.plusSeconds(1), "newsCollector", "cycle-1", false, 321, 0));
        eventBus.publish(new AlertRaised(AT.plusSeconds(2), "collector", "Job run failed: newsCollector - boom",
                Map.of("collector", "newsCollector")));

        Map<?, ?> status = (Map<?, ?>) tracker.collectorsSnapshot().get("newsCollector");
        assertEquals(false, status.get("lastSuccess"));
        assertEquals(321L, status.get("lastDurationMillis"));
        assertEquals(0, status.get("lastItemCount"));
        assertTrue(String.valueOf(status.get("lastErrorMessage")).contains("boom"));

        eventBus.publish(new CollectorTickCompleted(AT.plusSeconds(300), "newsCollector", "cycle-2", true, 120, 7));
        status = (Map<?, ?>) tracker.collectorsSnapshot().get("newsCollector");
        assertEquals(true, status.get("lastSuccess"));
        assertEquals(7, status.get("lastItemCount"));
        assertEquals(null, status.get("lastErrorMessage"));
    }
}
