package com.newsrelay.collectors.source;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.CollectorResult;
import com.newsrelay.collectors.api.FetchOutcome;
import com.newsrelay.collectors.api.SourceFetcher;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.collectors.fetch.Deadline;
import com.newsrelay.collectors.fetch.FetchErrorClassifier;
import com.newsrelay.collectors.fetch.FetchErrorCode;
import com.newsrelay.collectors.fetch.FetchException;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.CollectorTickCompleted;
import com.newsrelay.core.events.CollectorTickStarted;
import com.newsrelay.core.events.ItemRejected;
import com.newsrelay.core.events.SourceFetched;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceFetchState;
import com.newsrelay.core.model.SourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class NewsCollector implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(NewsCollector.class.getName());
    private static final String NAME = "newsCollector";
    private static final Duration JOIN_GRACE = Duration.ofSeconds(5);

    private final List<SourceConfig> sources;
    private final Map<SourceType, SourceFetcher> fetchers = new EnumMap<>(SourceType.class);
    private final CollectorContext ctx;
    private final SourceHealthPolicy healthPolicy;
    private final ExecutorService pool;
    private final Map<String, List<NewsItem>> lastGood = new ConcurrentHashMap<>();
    private final Duration joinGrace;

    public NewsCollector(List<SourceConfig> sources, List<SourceFetcher> sourceFetchers, CollectorContext ctx) {
        this(sources, sourceFetchers, ctx, JOIN_GRACE);
    }

    NewsCollector(List<SourceConfig> sources, List<SourceFetcher> sourceFetchers, CollectorContext ctx, Duration joinGrace) {
        this.joinGrace = Objects.requireNonNull(joinGrace, "joinGrace is required");
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources is required"));
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        for (SourceFetcher fetcher : sourceFetchers) {
            fetchers.put(fetcher.type(), fetcher);
        }
        this.healthPolicy = new SourceHealthPolicy(ctx.settings().cooldown());
        AtomicInteger threadIds = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(ctx.settings().concurrency(), runnable -> {
            Thread thread = new Thread(runnable, "collector-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public String name() {
        return NAME;
    }

    public CollectorResult collectAll(String cycleId) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(startedAt, NAME, cycleId));

        int skippedCooldown = 0;
        int skippedDisabled = 0;
        List<CompletableFuture<SourcePollOutcome>> tasks = new ArrayList<>();
        for (SourceConfig source : sources) {
            if (!source.enabled()) {
                skippedDisabled++;
                continue;
            }
            SourceFetchState state = stateOf(source);
            if (state.inCooldown(startedAt)) {
                skippedCooldown++;
                LOGGER.fine("Skipping " + source.source() + " until " + state.nextFetchAt());
                continue;
            }
            tasks.add(dispatch(source, state));
        }

        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
        List<SourcePollOutcome> outcomes = tasks.stream().map(CompletableFuture::join).toList();

        List<NewsItem> items = new ArrayList<>();
        Map<String, Integer> errors = new HashMap<>();
        int succeeded = 0;
        for (SourcePollOutcome outcome : outcomes) {
            items.addAll(outcome.items());
            if (outcome.success()) {
                succeeded++;
            } else {
                errors.merge(outcome.errorCode(), 1, Integer::sum);
            }
        }
        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", sources.size());
        stats.put("polled", outcomes.size());
        stats.put("succeeded", succeeded);
        stats.put("failed", outcomes.size() - succeeded);
        stats.put("skippedCooldown", skippedCooldown);
        stats.put("skippedDisabled", skippedDisabled);
        stats.put("items", items.size());
        stats.put("errors", Map.copyOf(errors));

        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        boolean success = succeeded == outcomes.size();
        ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), NAME, cycleId, success, durationMillis, items.size()));
        LOGGER.info("Cycle " + cycleId + ": polled " + outcomes.size() + " sources (" + succeeded + " ok, "
                + skippedCooldown + " cooling down), " + items.size() + " candidates");
        if (success) {
            return CollectorResult.success("Collection completed", items, stats);
        }
        return CollectorResult.failure("Collection had failures", items, stats);
    }

    // The join limit counts from the moment a worker picks the source up, not from submission.
    private CompletableFuture<SourcePollOutcome> dispatch(SourceConfig source, SourceFetchState state) {
        Duration joinLimit = ctx.settings().sourceTimeout().plus(joinGrace);
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<SourcePollOutcome> polled = new CompletableFuture<>();
        Future<?> running = pool.submit(() -> {
            polled.orTimeout(joinLimit.toMillis(), TimeUnit.MILLISECONDS);
            polled.complete(pollSource(source, state, settled));
        });
        return polled.exceptionally(error -> {
            running.cancel(true);
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                return fail(source, state, FetchErrorCode.TIMEOUT, "No result within " + joinLimit.toMillis() + "ms",
                        ctx.clock().instant(), settled);
            }
            return fail(source, state, FetchErrorClassifier.classify(cause), FetchErrorClassifier.rootMessage(cause),
                    ctx.clock().instant(), settled);
        });
    }

    private SourcePollOutcome pollSource(SourceConfig source, SourceFetchState previous, AtomicBoolean settled) {
        Instant started = ctx.clock().instant();
        Deadline deadline = Deadline.after(ctx.settings().sourceTimeout());
        SourceFetcher fetcher = fetchers.get(source.type());
        if (fetcher == null) {
            return fail(source, previous, FetchErrorCode.FETCH_ERROR, "No fetcher for type " + source.type(), started, settled);
        }
        try {
            FetchOutcome outcome = fetchWithMirrors(fetcher, source, deadline);
            List<NewsItem> items = outcome.items();
            if (!settled.compareAndSet(false, true)) {
                LOGGER.warning("Discarding late result of " + source.source() + " after it timed out");
                return SourcePollOutcome.discarded(source.source());
            }
            if (outcome.notModified()) {
                items = lastGood.getOrDefault(source.source(), List.of());
                LOGGER.fine("Source " + source.source() + " not modified, reusing " + items.size() + " cached items");
            } else {
                lastGood.put(source.source(), items);
            }
            for (FetchOutcome.DroppedEntry dropped : outcome.dropped()) {
                ctx.eventBus().publish(new ItemRejected(ctx.clock().instant(), source.source(), dropped.url(), dropped.reason().code()));
            }
            int status = outcome.notModified() ? 304 : 200;
            saveState(healthPolicy.onSuccess(previous, status, ctx.clock().instant()));
            ctx.eventBus().publish(new SourceFetched(ctx.clock().instant(), source.source(), source.url(),
                    String.valueOf(status), null, items.size(), elapsedMillis(started)));
            return new SourcePollOutcome(source.source(), true, null, items);
        } catch (FetchException e) {
            return fail(source, previous, e.code(), e.getMessage(), started, settled);
        } catch (RuntimeException e) {
            return fail(source, previous, FetchErrorClassifier.classify(e), FetchErrorClassifier.rootMessage(e), started, settled);
        }
    }

    private FetchOutcome fetchWithMirrors(SourceFetcher fetcher, SourceConfig source, Deadline deadline) throws FetchException {
        try {
            return fetcher.fetch(source, ctx, deadline);
        } catch (FetchException primaryFailure) {
            if (!primaryFailure.code().isHttp(503) || source.mirrors().isEmpty()) {
                throw primaryFailure;
            }
            for (String mirror : source.mirrors()) {
                if (deadline.expired()) {
                    break;
                }
                try {
                    LOGGER.info("Source " + source.source() + " unavailable, trying mirror " + mirror);
                    return fetcher.fetch(source.withUrl(mirror), ctx, deadline);
                } catch (FetchException mirrorFailure) {
                    LOGGER.warning("Mirror " + mirror + " failed for " + source.source() + ": " + mirrorFailure.code());
                }
            }
            throw primaryFailure;
        }
    }

    private SourcePollOutcome fail(
            SourceConfig source,
            SourceFetchState previous,
            FetchErrorCode code,
            String message,
            Instant started,
            AtomicBoolean settled
    ) {
        if (!settled.compareAndSet(false, true)) {
            LOGGER.fine("Ignoring late failure of " + source.source() + " [" + code + "]: " + message);
            return SourcePollOutcome.discarded(source.source());
        }
        LOGGER.warning("Fetch failed for " + source.source() + " [" + code + "]: " + message);
        saveState(healthPolicy.onFailure(previous, source, code, ctx.clock().instant()));
        ctx.eventBus().publish(new SourceFetched(ctx.clock().instant(), source.source(), source.url(),
                "error", code.value(), 0, elapsedMillis(started)));
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                "Fetch failed for " + source.source() + ": " + code,
                Map.of("collector", NAME, "source", source.source(), "url", source.url(), "errorCode", code.value())
        ));
        return new SourcePollOutcome(source.source(), false, code.value(), List.of());
    }

    private SourceFetchState stateOf(SourceConfig source) {
        try {
            return ctx.newsStore().sourceState(source.source()).orElseGet(() -> SourceFetchState.initial(source.source()));
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not read fetch state for " + source.source(), e);
            return SourceFetchState.initial(source.source());
        }
    }

    private void saveState(SourceFetchState state) {
        try {
            ctx.newsStore().putSourceState(state);
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not persist fetch state for " + state.source(), e);
        }
    }

    private long elapsedMillis(Instant started) {
        return Duration.between(started, ctx.clock().instant()).toMillis();
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private record SourcePollOutcome(String source, boolean success, String errorCode, List<NewsItem> items) {
        static SourcePollOutcome discarded(String source) {
            return new SourcePollOutcome(source, false, FetchErrorCode.TIMEOUT.value(), List.of());
        }
    }
}
