package com.newsrelay.core.bus;

import com.newsrelay.core.events.CollectorTickStarted;
import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.ItemRejected;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(CollectorTickStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "newsCollector", "cycle-1"));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToExactTypeAndToEventSupertype() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger rejectHits = new AtomicInteger();
        AtomicInteger allHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(ItemRejected.class, event -> rejectHits.incrementAndGet());
        bus.subscribe(Event.class, event -> allHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "newsCollector", "cycle-1"));
        bus.publish(new ItemRejected(NOW, "feed", "https://example.com/a", "low-quality"));

        assertEquals(1, tickHits.get());
        assertEquals(1, rejectHits.get());
        assertEquals(2, allHits.get());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CollectorTickStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(NOW, "newsCollector", "cycle-1"));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void unsubscribedHandlerStopsReceiving() {
        EventBus bus = new EventBus();
        AtomicInteger hits = new AtomicInteger();
        Consumer<CollectorTickStarted> handler = event -> hits.incrementAndGet();

        bus.subscribe(CollectorTickStarted.class, handler);
        bus.publish(new CollectorTickStarted(NOW, "newsCollector", "cycle-1"));
        assertTrue(bus.unsubscribe(CollectorTickStarted.class, handler));
        bus.publish(new CollectorTickStarted(NOW, "newsCollector", "cycle-2"));

        assertEquals(1, hits.get());
    }
}
