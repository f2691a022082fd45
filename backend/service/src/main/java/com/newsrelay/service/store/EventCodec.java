package com.newsrelay.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CollectorTickStarted", CollectorTickStarted.class,
            "CollectorTickCompleted", CollectorTickCompleted.class,
            "SourceFetched", SourceFetched.class,
            "ItemAccepted", ItemAccepted.class,
            "ItemRejected", ItemRejected.class,
            "ItemDelivered", ItemDelivered.class,
            "DeliveryFailed", DeliveryFailed.class,
            "EnrichmentDegraded", EnrichmentDegraded.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribe(Event.class, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
