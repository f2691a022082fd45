package com.newsrelay.service.runtime;

import com.newsrelay.collectors.api.CollectorResult;
import com.newsrelay.collectors.api.NewsStore;
import com.newsrelay.collectors.api.StopSignal;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.ingest.IngestProcessor;
import com.newsrelay.collectors.ingest.IngestReport;
import com.newsrelay.collectors.source.NewsCollector;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.service.delivery.DeliveryEngine;
import com.newsrelay.service.delivery.FanOutReport;
import com.newsrelay.service.lease.InstanceLock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

public class NewsPipeline {
    private static final Logger LOGGER = Logger.getLogger(NewsPipeline.class.getName());

    private final NewsCollector collector;
    private final IngestProcessor ingest;
    private final DeliveryEngine delivery;
    private final NewsStore newsStore;
    private final EnrichmentGateway gateway;
    private final StopSignal stopSignal;
    private final InstanceLock instanceLock;
    private final Clock clock;
    private final AtomicBoolean inFlight = new AtomicBoolean();

    public NewsPipeline(
            NewsCollector collector,
            IngestProcessor ingest,
            DeliveryEngine delivery,
            NewsStore newsStore,
            EnrichmentGateway gateway,
            StopSignal stopSignal,
            InstanceLock instanceLock,
            Clock clock
    ) {
        this.collector = Objects.requireNonNull(collector, "collector is required");
        this.ingest = Objects.requireNonNull(ingest, "ingest is required");
        this.delivery = Objects.requireNonNull(delivery, "delivery is required");
        this.newsStore = Objects.requireNonNull(newsStore, "newsStore is required");
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.stopSignal = stopSignal == null ? StopSignal.NEVER : stopSignal;
        this.instanceLock = Objects.requireNonNull(instanceLock, "instanceLock is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public int collectAndPublish() {
        if (!inFlight.compareAndSet(false, true)) {
            LOGGER.info("Collection cycle already in flight; skipping");
            return 0;
        }
        try {
            if (stopSignal.isStopped()) {
                LOGGER.info("Collection is stopped; skipping cycle");
                return 0;
            }
            if (!instanceLock.tryAcquire()) {
                LOGGER.info("Another instance holds the collection lease; skipping cycle");
                return 0;
            }
            return runCycle("cycle-" + UUID.randomUUID());
        } finally {
            inFlight.set(false);
        }
    }

    public boolean cycleInFlight() {
        return inFlight.get();
    }

    private int runCycle(String cycleId) {
        Instant startedAt = clock.instant();
        gateway.beginCycle(cycleId);
        int retried = delivery.retryFailed();
        CollectorResult collected = collector.collectAll(cycleId);
        IngestReport report = ingest.process(collected.items());

        List<NewsItem> accepted = report.accepted().stream()
                .sorted(Comparator.comparingLong(NewsItem::id))
                .toList();
        int published = 0;
        int delivered = 0;
        for (int i = 0; i < accepted.size(); i++) {
            if (stopSignal.isStopped()) {
                int rolledBack = rollback(accepted.subList(i, accepted.size()));
                LOGGER.warning("Collection stopped mid-cycle " + cycleId + "; rolled back " + rolledBack + " unpublished items");
                break;
            }
            FanOutReport fanOut = delivery.publish(accepted.get(i));
            delivered += fanOut.delivered();
            published++;
        }

        LOGGER.info("Cycle " + cycleId + " finished in " + Duration.between(startedAt, clock.instant()).toMillis()
                + "ms: candidates=" + collected.items().size()
                + " accepted=" + accepted.size()
                + " rejected=" + report.rejectedCount()
                + " published=" + published
                + " deliveries=" + delivered
                + " retried=" + retried);
        return published;
    }

    private int rollback(List<NewsItem> unpublished) {
        int rolledBack = 0;
        for (NewsItem item : unpublished) {
            try {
                if (newsStore.rollback(item.id())) {
                    rolledBack++;
                }
            } catch (StoreException e) {
                LOGGER.log(Level.WARNING, "Could not roll back item " + item.id() + "; it stays accepted", e);
            }
        }
        return rolledBack;
    }
}
