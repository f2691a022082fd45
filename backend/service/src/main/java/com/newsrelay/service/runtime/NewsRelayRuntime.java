package com.newsrelay.service.runtime;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.classify.ItemClassifier;
import com.newsrelay.collectors.dedup.DedupEngine;
import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.LlmService;
import com.newsrelay.collectors.extract.ArticleExtractor;
import com.newsrelay.collectors.fetch.HttpFetcher;
import com.newsrelay.collectors.ingest.IngestProcessor;
import com.newsrelay.collectors.quality.ContentQualityScorer;
import com.newsrelay.collectors.quality.FreshnessPolicy;
import com.newsrelay.collectors.rss.RssSourceFetcher;
import com.newsrelay.collectors.site.HtmlSourceFetcher;
import com.newsrelay.collectors.source.NewsCollector;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.service.config.PipelineConfig;
import com.newsrelay.service.config.StorageSettings;
import com.newsrelay.service.delivery.DeliveryEngine;
import com.newsrelay.service.delivery.MessageTransport;
import com.newsrelay.service.delivery.StaticSubscriberDirectory;
import com.newsrelay.service.diagnostics.DiagnosticsTracker;
import com.newsrelay.service.lease.CollectionStopLease;
import com.newsrelay.service.lease.InstanceLock;
import com.newsrelay.service.store.EventCodec;
import com.newsrelay.service.store.JsonFileNewsStore;
import com.newsrelay.service.store.JsonlEventStore;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class NewsRelayRuntime implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(NewsRelayRuntime.class.getName());

    private final EventBus eventBus;
    private final JsonFileNewsStore store;
    private final JsonlEventStore eventStore;
    private final CollectionStopLease stopLease;
    private final InstanceLock instanceLock;
    private final EnrichmentGateway gateway;
    private final NewsCollector collector;
    private final DeliveryEngine deliveryEngine;
    private final NewsPipeline pipeline;
    private final DiagnosticsTracker diagnostics;
    private final SchedulerService scheduler;

    public NewsRelayRuntime(
            PipelineConfig config,
            List<SourceConfig> sources,
            List<Subscriber> subscribers,
            Path dataDir,
            HttpClient httpClient,
            HttpClient insecureHttpClient,
            LlmService llmService,
            MessageTransport transport,
            Clock clock
    ) {
        StorageSettings storage = config.storage();
        this.eventBus = new EventBus();
        this.store = new JsonFileNewsStore(dataDir.resolve(storage.storeFile()));
        this.eventStore = new JsonlEventStore(dataDir.resolve(storage.eventLogFile()));
        EventCodec.subscribeAll(eventBus, eventStore::append);
        this.diagnostics = new DiagnosticsTracker(eventBus, clock);
        this.stopLease = new CollectionStopLease(dataDir.resolve(storage.stopLeaseFile()), clock);
        this.instanceLock = new InstanceLock(dataDir.resolve(storage.instanceLeaseFile()), storage.instanceLeaseTtl(), clock);

        this.gateway = llmService == null
                ? EnrichmentGateway.disabled(store, eventBus, clock)
                : new EnrichmentGateway(config.enrichment(), llmService, store, eventBus, stopLease, clock);
        if (llmService == null) {
            LOGGER.info("No LLM service configured; enrichment is disabled");
        }

        HttpFetcher fetcher = new HttpFetcher(
                httpClient,
                insecureHttpClient,
                config.collector().requestTimeout(),
                config.collector().retries(),
                config.collector().retryBackoff()
        );
        CollectorContext context = new CollectorContext(fetcher, eventBus, store, clock, config.collector());
        this.collector = new NewsCollector(sources, List.of(new RssSourceFetcher(), new HtmlSourceFetcher()), context);

        ContentQualityScorer scorer = new ContentQualityScorer(config.qualityProfiles());
        IngestProcessor ingest = new IngestProcessor(
                store,
                new DedupEngine(store, config.dedup(), clock),
                new FreshnessPolicy(config.collector().maxItemAge(), config.collector().requirePublishedDate()),
                new ArticleExtractor(scorer, gateway),
                scorer,
                ItemClassifier.withGateway(gateway),
                gateway,
                config.enrichment().summaryMinChars(),
                eventBus,
                clock
        );
        this.deliveryEngine = new DeliveryEngine(
                store,
                store,
                new StaticSubscriberDirectory(subscribers),
                transport,
                eventBus,
                clock,
                config.delivery()
        );
        this.pipeline = new NewsPipeline(collector, ingest, deliveryEngine, store, gateway, stopLease, instanceLock, clock);
        this.scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledJob(collector.name(), pipeline::collectAndPublish,
                        config.schedule().collectInterval(), config.schedule().enabled()),
                new SchedulerService.ScheduledJob("cacheSweep", this::sweepCache,
                        config.schedule().cacheSweepInterval(), config.enrichment().enabled())
        ), eventBus, clock);
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public JsonFileNewsStore store() {
        return store;
    }

    public JsonlEventStore eventStore() {
        return eventStore;
    }

    public CollectionStopLease stopLease() {
        return stopLease;
    }

    public InstanceLock instanceLock() {
        return instanceLock;
    }

    public EnrichmentGateway gateway() {
        return gateway;
    }

    public DeliveryEngine deliveryEngine() {
        return deliveryEngine;
    }

    public NewsPipeline pipeline() {
        return pipeline;
    }

    public DiagnosticsTracker diagnostics() {
        return diagnostics;
    }

    public SchedulerService scheduler() {
        return scheduler;
    }

    private void sweepCache() {
        int removed = gateway.sweepCache();
        if (removed > 0) {
            LOGGER.info("Removed " + removed + " expired enrichment cache entries");
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        collector.close();
        deliveryEngine.close();
        gateway.close();
        try {
            instanceLock.release();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Could not release instance lease", e);
        }
    }
}
