package com.newsrelay.service.delivery;

import com.newsrelay.collectors.api.NewsStore;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.DeliveryFailed;
import com.newsrelay.core.events.ItemDelivered;
import com.newsrelay.core.model.DeliveryLogEntry;
import com.newsrelay.core.model.DeliveryState;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.Subscriber;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DeliveryEngine implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(DeliveryEngine.class.getName());

    private final DeliveryStore deliveryStore;
    private final NewsStore newsStore;
    private final SubscriberDirectory directory;
    private final MessageTransport transport;
    private final EventBus eventBus;
    private final Clock clock;
    private final DeliverySettings settings;
    private final ExecutorService fanOutPool;
    private final Map<String, ReentrantLock> replayLocks = new ConcurrentHashMap<>();

    public DeliveryEngine(
            DeliveryStore deliveryStore,
            NewsStore newsStore,
            SubscriberDirectory directory,
            MessageTransport transport,
            EventBus eventBus,
            Clock clock,
            DeliverySettings settings
    ) {
        this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore is required");
        this.newsStore = Objects.requireNonNull(newsStore, "newsStore is required");
        this.directory = Objects.requireNonNull(directory, "directory is required");
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = settings == null ? DeliverySettings.defaults() : settings;
        AtomicInteger threadIds = new AtomicInteger();
        this.fanOutPool = Executors.newFixedThreadPool(this.settings.fanOutThreads(), runnable -> {
            Thread thread = new Thread(runnable, "delivery-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public FanOutReport publish(NewsItem item) {
        Objects.requireNonNull(item.id(), "only accepted items can be published");
        List<CompletableFuture<DeliveryOutcome>> attempts = new ArrayList<>();
        for (Subscriber subscriber : directory.subscribers()) {
            attempts.add(CompletableFuture.supplyAsync(() -> deliver(item, subscriber), fanOutPool)
                    .exceptionally(error -> {
                        LOGGER.log(Level.WARNING, "Delivery of item " + item.id() + " to " + subscriber.id() + " failed", error);
                        return DeliveryOutcome.STORE_FAILED;
                    }));
        }
        CompletableFuture.allOf(attempts.toArray(CompletableFuture[]::new)).join();

        Map<DeliveryOutcome, Integer> outcomes = new EnumMap<>(DeliveryOutcome.class);
        for (CompletableFuture<DeliveryOutcome> attempt : attempts) {
            outcomes.merge(attempt.join(), 1, Integer::sum);
        }
        FanOutReport report = new FanOutReport(item.id(), outcomes);
        LOGGER.fine("Item " + item.id() + " fan-out: " + outcomes);
        return report;
    }

    public DeliveryOutcome deliver(NewsItem item, Subscriber subscriber) {
        return attempt(item, subscriber, false);
    }

    public DeliveryState pause(String subscriberId) {
        DeliveryState state = deliveryStore.recordPauseTransition(subscriberId, true, clock.instant());
        LOGGER.info("Subscriber " + subscriberId + " paused (version " + state.pauseVersion() + ")");
        return state;
    }

    public int resume(String subscriberId) {
        DeliveryState resumed = deliveryStore.recordPauseTransition(subscriberId, false, clock.instant());
        LOGGER.info("Subscriber " + subscriberId + " resumed (version " + resumed.pauseVersion() + ")");
        return directory.subscriber(subscriberId)
                .map(subscriber -> replay(subscriber, resumed.lastDeliveredItemId()))
                .orElse(0);
    }

    public DeliveryState state(String subscriberId) {
        return deliveryStore.deliveryState(subscriberId);
    }

    public int retryFailed() {
        Instant cutoff = clock.instant().minus(settings.replayWindow());
        Map<String, List<NewsItem>> retries = new TreeMap<>();
        for (DeliveryLogEntry pending : deliveryStore.pendingRetries()) {
            Optional<NewsItem> item = newsStore.item(pending.itemId()).filter(found -> !found.acceptedAt().isBefore(cutoff));
            if (item.isEmpty() || directory.subscriber(pending.subscriberId()).isEmpty()) {
                LOGGER.fine("Dropping pending retry " + pending.key());
                clearRetry(pending.subscriberId(), pending.itemId());
                continue;
            }
            retries.computeIfAbsent(pending.subscriberId(), ignored -> new ArrayList<>()).add(item.get());
        }
        int delivered = 0;
        for (Map.Entry<String, List<NewsItem>> entry : retries.entrySet()) {
            Optional<Subscriber> subscriber = directory.subscriber(entry.getKey());
            if (subscriber.isPresent()) {
                delivered += redeliver(subscriber.get(), entry.getValue(), "retry");
            }
        }
        if (delivered > 0) {
            LOGGER.info("Retried failed deliveries: " + delivered + " delivered");
        }
        return delivered;
    }

    int replay(Subscriber subscriber, long fromItemId) {
        Instant cutoff = clock.instant().minus(settings.replayWindow());
        TreeMap<Long, NewsItem> missed = new TreeMap<>();
        for (NewsItem item : newsStore.acceptedAfter(fromItemId, cutoff)) {
            missed.put(item.id(), item);
        }
        for (DeliveryLogEntry pending : deliveryStore.pendingRetries()) {
            if (pending.subscriberId().equals(subscriber.id()) && !missed.containsKey(pending.itemId())) {
                newsStore.item(pending.itemId())
                        .filter(item -> !item.acceptedAt().isBefore(cutoff))
                        .ifPresent(item -> missed.put(item.id(), item));
            }
        }
        return redeliver(subscriber, new ArrayList<>(missed.values()), "replay");
    }

    private int redeliver(Subscriber subscriber, List<NewsItem> items, String purpose) {
        ReentrantLock lock = replayLocks.computeIfAbsent(subscriber.id(), ignored -> new ReentrantLock());
        lock.lock();
        try {
            List<NewsItem> ordered = items.stream().sorted(Comparator.comparingLong(NewsItem::id)).toList();
            int delivered = 0;
            for (NewsItem item : ordered) {
                DeliveryOutcome outcome = attempt(item, subscriber, true);
                if (outcome == DeliveryOutcome.PAUSED || outcome == DeliveryOutcome.PAUSE_RACE) {
                    LOGGER.info("The " + purpose + " for " + subscriber.id() + " was interrupted by a pause after "
                            + delivered + " items");
                    break;
                }
                if (outcome == DeliveryOutcome.DELIVERED) {
                    delivered++;
                }
                if (outcome == DeliveryOutcome.DUPLICATE || outcome == DeliveryOutcome.FILTERED) {
                    clearRetry(subscriber.id(), item.id());
                }
            }
            if (!ordered.isEmpty()) {
                LOGGER.info("The " + purpose + " delivered " + delivered + " of " + ordered.size() + " items to " + subscriber.id());
            }
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    // Replays ignore the id watermark; the delivery log alone keeps each pair unique.
    private DeliveryOutcome attempt(NewsItem item, Subscriber subscriber, boolean replay) {
        long itemId = item.id();
        DeliveryState snapshot = deliveryStore.deliveryState(subscriber.id());
        if (snapshot.paused()) {
            return DeliveryOutcome.PAUSED;
        }
        if (!replay && itemId <= snapshot.lastDeliveredItemId()) {
            return DeliveryOutcome.ALREADY_DELIVERED;
        }
        if (!subscriber.accepts(item)) {
            return DeliveryOutcome.FILTERED;
        }
        DeliveryState current = deliveryStore.deliveryState(subscriber.id());
        if (current.paused() || current.pauseVersion() != snapshot.pauseVersion()) {
            return DeliveryOutcome.PAUSE_RACE;
        }

        try {
            if (!deliveryStore.insertDeliveryLog(new DeliveryLogEntry(subscriber.id(), itemId, clock.instant()))) {
                return DeliveryOutcome.DUPLICATE;
            }
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not log delivery of item " + itemId + " to " + subscriber.id(), e);
            return DeliveryOutcome.STORE_FAILED;
        }

        try {
            transport.send(subscriber.id(), DeliveryMessage.of(item));
        } catch (DeliveryException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Sending item " + itemId + " to " + subscriber.id() + " failed", e);
            releaseClaim(subscriber.id(), itemId);
            eventBus.publish(new DeliveryFailed(clock.instant(), subscriber.id(), itemId, e.getMessage()));
            return DeliveryOutcome.SEND_FAILED;
        }

        advanceLastDelivered(subscriber.id(), itemId);
        clearRetry(subscriber.id(), itemId);
        eventBus.publish(new ItemDelivered(clock.instant(), subscriber.id(), itemId, replay));
        return DeliveryOutcome.DELIVERED;
    }

    private void releaseClaim(String subscriberId, long itemId) {
        try {
            deliveryStore.releaseFailedDelivery(subscriberId, itemId, clock.instant());
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not release delivery claim " + DeliveryLogEntry.key(subscriberId, itemId)
                    + "; the item will not be retried", e);
        }
    }

    private void clearRetry(String subscriberId, long itemId) {
        try {
            deliveryStore.clearPendingRetry(subscriberId, itemId);
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not clear pending retry " + DeliveryLogEntry.key(subscriberId, itemId), e);
        }
    }

    private void advanceLastDelivered(String subscriberId, long itemId) {
        try {
            while (true) {
                DeliveryState current = deliveryStore.deliveryState(subscriberId);
                if (current.lastDeliveredItemId() >= itemId) {
                    return;
                }
                if (deliveryStore.compareAndSetLastDelivered(subscriberId, current.lastDeliveredItemId(), itemId, clock.instant())) {
                    return;
                }
            }
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not advance delivery mark of " + subscriberId + " to " + itemId, e);
        }
    }

    @Override
    public void close() {
        fanOutPool.shutdown();
    }
}
