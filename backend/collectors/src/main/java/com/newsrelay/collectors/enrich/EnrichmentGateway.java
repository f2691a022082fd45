package com.newsrelay.collectors.enrich;

import com.newsrelay.collectors.api.StopSignal;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.collectors.config.EnrichmentSettings;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.model.CacheEntry;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.util.TextNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EnrichmentGateway implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(EnrichmentGateway.class.getName());

    private final EnrichmentSettings settings;
    private final LlmService llmService;
    private final ResponseCache cache;
    private final BudgetGuard budgetGuard;
    private final CallGate callGate;
    private final StopSignal stopSignal;
    private final ExecutorService callExecutor;

    public EnrichmentGateway(
            EnrichmentSettings settings,
            LlmService llmService,
            EnrichmentStore store,
            EventBus eventBus,
            StopSignal stopSignal,
            Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.llmService = llmService;
        this.cache = new ResponseCache(store, settings.cacheTtl(), clock);
        this.budgetGuard = new BudgetGuard(settings.budget(), store, eventBus, clock);
        this.callGate = new CallGate(settings.maxCallsPerCycle(), eventBus, clock);
        this.stopSignal = stopSignal == null ? StopSignal.NEVER : stopSignal;
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "llm-call");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static EnrichmentGateway disabled(EnrichmentStore store, EventBus eventBus, Clock clock) {
        return new EnrichmentGateway(EnrichmentSettings.disabled(), null, store, eventBus, StopSignal.NEVER, clock);
    }

    public boolean enabled(EnrichmentTask task) {
        return llmService != null && settings.allows(task);
    }

    public EnrichmentResult execute(EnrichmentRequest request) {
        if (stopSignal.isStopped()) {
            return EnrichmentResult.of(EnrichmentStatus.STOPPED);
        }
        if (!enabled(request.task())) {
            return EnrichmentResult.of(EnrichmentStatus.DISABLED);
        }
        Optional<CacheEntry> cached = lookup(request);
        if (cached.isPresent()) {
            recordQuietly(budgetGuard::recordCacheHit);
            CacheEntry entry = cached.get();
            return new EnrichmentResult(EnrichmentStatus.CACHE_HIT, entry.response(), entry.inputTokens(), entry.outputTokens());
        }
        String payload = TextNormalizer.truncate(request.payload(), settings.maxInputChars());
        BudgetReservation reservation = budgetGuard.reserve(request.task(), LlmResponse.estimateTokens(payload));
        if (!reservation.allowed()) {
            LOGGER.fine("Budget refused " + request.task().code() + ": " + reservation.decision());
            return EnrichmentResult.of(EnrichmentStatus.BUDGET_EXCEEDED);
        }
        try {
            if (!callGate.tryAcquire(request.task())) {
                return EnrichmentResult.of(EnrichmentStatus.GATE_CLOSED);
            }
            return callWithRetries(request, payload);
        } finally {
            budgetGuard.release(reservation);
        }
    }

    public Optional<String> summarize(NewsItem item) {
        return execute(new EnrichmentRequest(
                EnrichmentTask.SUMMARY,
                item.checksum(),
                item.cleanText() == null ? item.title() : item.cleanText(),
                Map.of("title", item.title(), "maxSentences", 3)
        )).text();
    }

    public Optional<String> cleanup(String contentIdentity, String rawText) {
        return execute(EnrichmentRequest.of(EnrichmentTask.CLEANUP, contentIdentity, rawText)).text();
    }

    public Optional<Category> verifyCategory(String contentIdentity, String title, String text, Category proposed) {
        EnrichmentRequest request = new EnrichmentRequest(
                EnrichmentTask.CATEGORY_VERIFY,
                contentIdentity,
                title + "\n\n" + (text == null ? "" : text),
                Map.of("proposed", proposed.code(), "allowed", "world,russia,moscow,moscow_region")
        );
        return execute(request).text().flatMap(answer -> Category.parse(answer.replace("\"", "").replace(".", "")));
    }

    public Optional<String> translate(String text, String targetLanguage) {
        return execute(new EnrichmentRequest(
                EnrichmentTask.TRANSLATION,
                null,
                text,
                Map.of("target", targetLanguage)
        )).text();
    }

    public Optional<String> classifyHashtags(String contentIdentity, String payload, Map<String, Object> params) {
        return execute(new EnrichmentRequest(EnrichmentTask.HASHTAGS, contentIdentity, payload, params)).text();
    }

    public void beginCycle(String cycleId) {
        callGate.beginCycle(cycleId);
    }

    public int sweepCache() {
        return cache.sweep();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public BudgetState budgetState() {
        return budgetGuard.state();
    }

    public BudgetGuard budgetGuard() {
        return budgetGuard;
    }

    private EnrichmentResult callWithRetries(EnrichmentRequest request, String payload) {
        Duration timeout = settings.callTimeout();
        for (int attempt = 0; attempt < settings.maxAttempts(); attempt++) {
            if (attempt > 0) {
                if (stopSignal.isStopped()) {
                    return EnrichmentResult.of(EnrichmentStatus.STOPPED);
                }
                if (!pause(settings.initialBackoff().multipliedBy(1L << Math.min(attempt - 1, 10)))) {
                    return EnrichmentResult.of(EnrichmentStatus.FAILED);
                }
            }
            CompletableFuture<LlmResponse> future = CompletableFuture.supplyAsync(() -> invoke(request.task(), payload, request.params()), callExecutor);
            try {
                LlmResponse response = withUsage(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS), payload);
                recordQuietly(() -> budgetGuard.record(response));
                recordQuietly(() -> cache.put(request, response));
                return new EnrichmentResult(EnrichmentStatus.OK, response.text(), response.inputTokens(), response.outputTokens());
            } catch (TimeoutException e) {
                future.cancel(true);
                LOGGER.warning("LLM " + request.task().code() + " call timed out after " + timeout.toMillis() + "ms (attempt " + (attempt + 1) + ")");
            } catch (ExecutionException e) {
                LOGGER.warning("LLM " + request.task().code() + " call failed (attempt " + (attempt + 1) + "): " + rootMessage(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return EnrichmentResult.of(EnrichmentStatus.FAILED);
            }
        }
        return EnrichmentResult.of(EnrichmentStatus.FAILED);
    }

    private LlmResponse invoke(EnrichmentTask task, String payload, Map<String, Object> params) {
        try {
            return llmService.call(task, payload, params);
        } catch (LlmCallException e) {
            throw new CompletionException(e);
        }
    }

    private static LlmResponse withUsage(LlmResponse response, String payload) {
        long in = response.inputTokens() > 0 ? response.inputTokens() : LlmResponse.estimateTokens(payload);
        long out = response.outputTokens() > 0 ? response.outputTokens() : LlmResponse.estimateTokens(response.text());
        return new LlmResponse(response.text(), in, out);
    }

    private Optional<CacheEntry> lookup(EnrichmentRequest request) {
        try {
            return cache.lookup(request);
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Enrichment cache lookup failed", e);
            return Optional.empty();
        }
    }

    private static void recordQuietly(Runnable write) {
        try {
            write.run();
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Failed to record enrichment usage", e);
        }
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
