package com.newsrelay.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.collectors.api.NewsStore;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.collectors.enrich.CacheStats;
import com.newsrelay.collectors.enrich.EnrichmentStore;
import com.newsrelay.core.model.BudgetLedger;
import com.newsrelay.core.model.CacheEntry;
import com.newsrelay.core.model.DeliveryLogEntry;
import com.newsrelay.core.model.DeliveryState;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceFetchState;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.service.delivery.DeliveryStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

public class JsonFileNewsStore implements NewsStore, EnrichmentStore, DeliveryStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileNewsStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final int WRITE_ATTEMPTS = 3;
    private static final Duration WRITE_BACKOFF = Duration.ofMillis(50);

    private final Path file;
    private final SnapshotWriter writer;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Long, NewsItem> items = new TreeMap<>();
    private final Map<String, Long> itemIdsByUrlHash = new HashMap<>();
    private final Map<String, Instant> seen = new HashMap<>();
    private final Map<Long, List<String>> keysByItem = new HashMap<>();
    private final Map<String, SourceFetchState> sourceStates = new HashMap<>();
    private final Map<String, CacheEntry> cache = new HashMap<>();
    private final Map<LocalDate, BudgetLedger> ledgers = new HashMap<>();
    private final Map<String, DeliveryState> deliveryStates = new HashMap<>();
    private final Map<String, DeliveryLogEntry> deliveryLog = new HashMap<>();
    private final Map<String, DeliveryLogEntry> pendingRetries = new HashMap<>();
    private long lastItemId;

    public JsonFileNewsStore(Path file) {
        this(file, JsonFileNewsStore::writeAtomically);
    }

    JsonFileNewsStore(Path file, SnapshotWriter writer) {
        this.file = file;
        this.writer = writer;
        loadIfPresent();
    }

    @Override
    public boolean isSeen(String key) {
        return read(() -> seen.containsKey(key));
    }

    @Override
    public void markSeen(Collection<String> keys, Instant at) {
        write("mark seen keys", () -> {
            List<String> added = new ArrayList<>();
            for (String key : keys) {
                if (seen.putIfAbsent(key, at) == null) {
                    added.add(key);
                }
            }
            if (added.isEmpty()) {
                return Applied.unchanged(null);
            }
            return Applied.of(null, () -> added.forEach(seen::remove));
        });
    }

    @Override
    public boolean isChecksumRecent(String checksum, Instant since) {
        return read(() -> items.values().stream()
                .anyMatch(item -> checksum.equals(item.checksum()) && !item.acceptedAt().isBefore(since)));
    }

    @Override
    public List<NewsItem> acceptedSince(Instant since) {
        return read(() -> items.values().stream().filter(item -> !item.acceptedAt().isBefore(since)).toList());
    }

    @Override
    public List<NewsItem> acceptedAfter(long itemId, Instant acceptedSince) {
        return read(() -> items.tailMap(itemId, false).values().stream()
                .filter(item -> !item.acceptedAt().isBefore(acceptedSince))
                .toList());
    }

    @Override
    public Optional<NewsItem> item(long id) {
        return read(() -> Optional.ofNullable(items.get(id)));
    }

    @Override
    public Optional<NewsItem> accept(NewsItem item, Collection<String> seenKeys, Instant at) {
        return write("accept " + item.url(), () -> {
            if (item.urlHash() != null && itemIdsByUrlHash.containsKey(item.urlHash())) {
                return Applied.unchanged(Optional.<NewsItem>empty());
            }
            long previousId = lastItemId;
            NewsItem accepted = item.accepted(previousId + 1, at);
            lastItemId = accepted.id();
            items.put(accepted.id(), accepted);
            if (accepted.urlHash() != null) {
                itemIdsByUrlHash.put(accepted.urlHash(), accepted.id());
            }
            List<String> keys = List.copyOf(seenKeys);
            keysByItem.put(accepted.id(), keys);
            List<String> added = new ArrayList<>();
            for (String key : keys) {
                if (seen.putIfAbsent(key, at) == null) {
                    added.add(key);
                }
            }
            return Applied.of(Optional.of(accepted), () -> {
                items.remove(accepted.id());
                if (accepted.urlHash() != null) {
                    itemIdsByUrlHash.remove(accepted.urlHash());
                }
                keysByItem.remove(accepted.id());
                added.forEach(seen::remove);
                lastItemId = previousId;
            });
        });
    }

    @Override
    public boolean rollback(long itemId) {
        return write("roll back item " + itemId, () -> {
            NewsItem removed = items.remove(itemId);
            if (removed == null) {
                return Applied.unchanged(false);
            }
            if (removed.urlHash() != null) {
                itemIdsByUrlHash.remove(removed.urlHash());
            }
            List<String> keys = keysByItem.remove(itemId);
            Map<String, Instant> forgotten = new HashMap<>();
            if (keys != null) {
                for (String key : keys) {
                    Instant at = seen.remove(key);
                    if (at != null) {
                        forgotten.put(key, at);
                    }
                }
            }
            return Applied.of(true, () -> {
                items.put(itemId, removed);
                if (removed.urlHash() != null) {
                    itemIdsByUrlHash.put(removed.urlHash(), itemId);
                }
                if (keys != null) {
                    keysByItem.put(itemId, keys);
                }
                seen.putAll(forgotten);
            });
        });
    }

    @Override
    public Optional<SourceFetchState> sourceState(String source) {
        return read(() -> Optional.ofNullable(sourceStates.get(source)));
    }

    @Override
    public void putSourceState(SourceFetchState state) {
        write("save fetch state of " + state.source(), () -> {
            SourceFetchState previous = sourceStates.put(state.source(), state);
            return Applied.of(null, () -> restore(sourceStates, state.source(), previous));
        });
    }

    @Override
    public Optional<CacheEntry> cacheEntry(String cacheKey) {
        return read(() -> Optional.ofNullable(cache.get(cacheKey)));
    }

    @Override
    public void putCacheEntry(CacheEntry entry) {
        write("cache response", () -> {
            CacheEntry previous = cache.put(entry.cacheKey(), entry);
            return Applied.of(null, () -> restore(cache, entry.cacheKey(), previous));
        });
    }

    @Override
    public int deleteExpiredCacheEntries(Instant now) {
        return write("sweep cache", () -> {
            Map<String, CacheEntry> expired = new HashMap<>();
            cache.forEach((key, entry) -> {
                if (entry.isExpired(now)) {
                    expired.put(key, entry);
                }
            });
            if (expired.isEmpty()) {
                return Applied.unchanged(0);
            }
            expired.keySet().forEach(cache::remove);
            return Applied.of(expired.size(), () -> cache.putAll(expired));
        });
    }

    @Override
    public CacheStats cacheStats(Instant now) {
        return read(() -> {
            long expired = cache.values().stream().filter(entry -> entry.isExpired(now)).count();
            return new CacheStats(cache.size(), cache.size() - expired, expired);
        });
    }

    @Override
    public BudgetLedger ledger(LocalDate day) {
        return read(() -> ledgers.getOrDefault(day, BudgetLedger.empty(day)));
    }

    @Override
    public BudgetLedger recordUsage(LocalDate day, UnaryOperator<BudgetLedger> update) {
        return write("record usage for " + day, () -> {
            BudgetLedger previous = ledgers.get(day);
            BudgetLedger next = update.apply(previous == null ? BudgetLedger.empty(day) : previous);
            ledgers.put(day, next);
            return Applied.of(next, () -> restore(ledgers, day, previous));
        });
    }

    @Override
    public DeliveryState deliveryState(String subscriberId) {
        return read(() -> deliveryStates.getOrDefault(subscriberId, DeliveryState.initial(subscriberId)));
    }

    @Override
    public DeliveryState recordPauseTransition(String subscriberId, boolean paused, Instant at) {
        return write("record pause state of " + subscriberId, () -> {
            DeliveryState previous = deliveryStates.get(subscriberId);
            DeliveryState current = previous == null ? DeliveryState.initial(subscriberId) : previous;
            DeliveryState next = current.transition(paused, at);
            deliveryStates.put(subscriberId, next);
            return Applied.of(next, () -> restore(deliveryStates, subscriberId, previous));
        });
    }

    @Override
    public boolean compareAndSetLastDelivered(String subscriberId, long expected, long next, Instant at) {
        return write("advance delivery mark of " + subscriberId, () -> {
            DeliveryState previous = deliveryStates.get(subscriberId);
            DeliveryState current = previous == null ? DeliveryState.initial(subscriberId) : previous;
            if (current.lastDeliveredItemId() != expected) {
                return Applied.unchanged(false);
            }
            deliveryStates.put(subscriberId, current.withLastDelivered(next, at));
            return Applied.of(true, () -> restore(deliveryStates, subscriberId, previous));
        });
    }

    @Override
    public boolean insertDeliveryLog(DeliveryLogEntry entry) {
        return write("log delivery " + entry.key(), () -> {
            if (deliveryLog.putIfAbsent(entry.key(), entry) != null) {
                return Applied.unchanged(false);
            }
            return Applied.of(true, () -> deliveryLog.remove(entry.key()));
        });
    }

    @Override
    public boolean removeDeliveryLog(String subscriberId, long itemId) {
        String key = DeliveryLogEntry.key(subscriberId, itemId);
        return write("remove delivery " + key, () -> {
            DeliveryLogEntry removed = deliveryLog.remove(key);
            if (removed == null) {
                return Applied.unchanged(false);
            }
            return Applied.of(true, () -> deliveryLog.put(key, removed));
        });
    }

    @Override
    public boolean releaseFailedDelivery(String subscriberId, long itemId, Instant failedAt) {
        String key = DeliveryLogEntry.key(subscriberId, itemId);
        return write("release failed delivery " + key, () -> {
            DeliveryLogEntry removed = deliveryLog.remove(key);
            DeliveryLogEntry previousRetry = pendingRetries.put(key, new DeliveryLogEntry(subscriberId, itemId, failedAt));
            return Applied.of(removed != null, () -> {
                if (removed != null) {
                    deliveryLog.put(key, removed);
                }
                restore(pendingRetries, key, previousRetry);
            });
        });
    }

    @Override
    public List<DeliveryLogEntry> pendingRetries() {
        return read(() -> pendingRetries.values().stream()
                .sorted(Comparator.comparingLong(DeliveryLogEntry::itemId).thenComparing(DeliveryLogEntry::subscriberId))
                .toList());
    }

    @Override
    public boolean clearPendingRetry(String subscriberId, long itemId) {
        String key = DeliveryLogEntry.key(subscriberId, itemId);
        return write("clear pending retry " + key, () -> {
            DeliveryLogEntry removed = pendingRetries.remove(key);
            if (removed == null) {
                return Applied.unchanged(false);
            }
            return Applied.of(true, () -> pendingRetries.put(key, removed));
        });
    }

    @Override
    public boolean isDelivered(String subscriberId, long itemId) {
        return read(() -> deliveryLog.containsKey(DeliveryLogEntry.key(subscriberId, itemId)));
    }

    @Override
    public List<DeliveryLogEntry> deliveryLog(String subscriberId) {
        return read(() -> deliveryLog.values().stream()
                .filter(entry -> entry.subscriberId().equals(subscriberId))
                .sorted(Comparator.comparingLong(DeliveryLogEntry::itemId))
                .toList());
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(String operation, Supplier<Applied<T>> mutation) {
        lock.writeLock().lock();
        try {
            Applied<T> applied = mutation.get();
            if (applied.undo() == null) {
                return applied.result();
            }
            try {
                persistWithRetries(operation);
            } catch (StoreException e) {
                applied.undo().run();
                throw e;
            }
            return applied.result();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persistWithRetries(String operation) {
        StoreSnapshot snapshot = snapshot();
        IOException lastError = null;
        for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
            try {
                writer.write(file, snapshot);
                return;
            } catch (IOException e) {
                lastError = e;
                LOGGER.warning("Failed to " + operation + " (attempt " + attempt + "/" + WRITE_ATTEMPTS + "): " + e.getMessage());
            }
            if (attempt < WRITE_ATTEMPTS) {
                try {
                    Thread.sleep(WRITE_BACKOFF.toMillis() << (attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StoreException("Interrupted while retrying to " + operation, e);
                }
            }
        }
        throw new StoreException("Failed to " + operation + " in " + file, lastError);
    }

    private StoreSnapshot snapshot() {
        return new StoreSnapshot(
                lastItemId,
                new ArrayList<>(items.values()),
                new HashMap<>(seen),
                new HashMap<>(keysByItem),
                new ArrayList<>(sourceStates.values()),
                new ArrayList<>(cache.values()),
                new ArrayList<>(ledgers.values()),
                new ArrayList<>(deliveryStates.values()),
                new ArrayList<>(deliveryLog.values()),
                new ArrayList<>(pendingRetries.values())
        );
    }

    private void loadIfPresent() {
        lock.writeLock().lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                StoreSnapshot loaded = MAPPER.readValue(in, StoreSnapshot.class);
                lastItemId = loaded.lastItemId();
                for (NewsItem item : orEmpty(loaded.items())) {
                    items.put(item.id(), item);
                    if (item.urlHash() != null) {
                        itemIdsByUrlHash.put(item.urlHash(), item.id());
                    }
                    lastItemId = Math.max(lastItemId, item.id());
                }
                if (loaded.seen() != null) {
                    seen.putAll(loaded.seen());
                }
                if (loaded.itemKeys() != null) {
                    keysByItem.putAll(loaded.itemKeys());
                }
                orEmpty(loaded.sources()).forEach(state -> sourceStates.put(state.source(), state));
                orEmpty(loaded.cache()).forEach(entry -> cache.put(entry.cacheKey(), entry));
                orEmpty(loaded.ledgers()).forEach(ledger -> ledgers.put(ledger.day(), ledger));
                orEmpty(loaded.deliveryStates()).forEach(state -> deliveryStates.put(state.subscriberId(), state));
                orEmpty(loaded.deliveryLog()).forEach(entry -> deliveryLog.put(entry.key(), entry));
                orEmpty(loaded.pendingRetries()).forEach(entry -> pendingRetries.put(entry.key(), entry));
            }
            LOGGER.info("Loaded " + items.size() + " items and " + seen.size() + " seen keys from " + file);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed loading store from " + file, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    static void writeAtomically(Path file, StoreSnapshot snapshot) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writeValue(out, snapshot);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static <K, V> void restore(Map<K, V> map, K key, V previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    @FunctionalInterface
    interface SnapshotWriter {
        void write(Path file, StoreSnapshot snapshot) throws IOException;
    }

    record StoreSnapshot(
            long lastItemId,
            List<NewsItem> items,
            Map<String, Instant> seen,
            Map<Long, List<String>> itemKeys,
            List<SourceFetchState> sources,
            List<CacheEntry> cache,
            List<BudgetLedger> ledgers,
            List<DeliveryState> deliveryStates,
            List<DeliveryLogEntry> deliveryLog,
            List<DeliveryLogEntry> pendingRetries
    ) {
    }

    private record Applied<T>(T result, Runnable undo) {
        static <T> Applied<T> of(T result, Runnable undo) {
            return new Applied<>(result, undo);
        }

        static <T> Applied<T> unchanged(T result) {
            return new Applied<>(result, null);
        }
    }
}
