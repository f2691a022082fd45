package com.newsrelay.collectors.ingest;

import com.newsrelay.collectors.api.NewsStore;
import com.newsrelay.collectors.api.StoreException;
import com.newsrelay.collectors.classify.ItemClassifier;
import com.newsrelay.collectors.dedup.DedupEngine;
import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.extract.ArticleExtractor;
import com.newsrelay.collectors.quality.ContentQualityScorer;
import com.newsrelay.collectors.quality.FreshnessPolicy;
import com.newsrelay.collectors.quality.QualityVerdict;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.ItemAccepted;
import com.newsrelay.core.events.ItemRejected;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.util.HashingUtils;
import com.newsrelay.core.util.SimHash;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class IngestProcessor {
    private static final Logger LOGGER = Logger.getLogger(IngestProcessor.class.getName());

    private final NewsStore store;
    private final DedupEngine dedup;
    private final FreshnessPolicy freshness;
    private final ArticleExtractor extractor;
    private final ContentQualityScorer scorer;
    private final ItemClassifier classifier;
    private final EnrichmentGateway gateway;
    private final int summaryMinChars;
    private final EventBus eventBus;
    private final Clock clock;

    public IngestProcessor(
            NewsStore store,
            DedupEngine dedup,
            FreshnessPolicy freshness,
            ArticleExtractor extractor,
            ContentQualityScorer scorer,
            ItemClassifier classifier,
            EnrichmentGateway gateway,
            int summaryMinChars,
            EventBus eventBus,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.dedup = Objects.requireNonNull(dedup, "dedup is required");
        this.freshness = Objects.requireNonNull(freshness, "freshness is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.gateway = gateway;
        this.summaryMinChars = summaryMinChars;
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public IngestReport process(List<NewsItem> candidates) {
        List<NewsItem> accepted = new ArrayList<>();
        Map<RejectReason, Integer> rejected = new EnumMap<>(RejectReason.class);
        for (NewsItem candidate : candidates) {
            Outcome outcome = ingest(candidate);
            if (outcome.accepted() != null) {
                accepted.add(outcome.accepted());
            } else {
                rejected.merge(outcome.reason(), 1, Integer::sum);
            }
        }
        LOGGER.info("Ingested " + candidates.size() + " candidates: " + accepted.size() + " accepted, rejected " + rejected);
        return new IngestReport(accepted, rejected);
    }

    Outcome ingest(NewsItem candidate) {
        NewsItem item = dedup.withUrlKeys(candidate);
        Optional<RejectReason> seen = dedup.checkSeen(item);
        if (seen.isPresent()) {
            return reject(item, seen.get());
        }

        Instant now = clock.instant();
        FreshnessPolicy.Result fresh = freshness.apply(item, now);
        if (fresh.kept().isEmpty()) {
            return reject(item, fresh.rejectReason());
        }
        item = extractor.extract(fresh.kept().get());

        String text = item.cleanText() == null ? "" : item.cleanText();
        item = item.withFingerprints(
                HashingUtils.contentChecksum(text),
                SimHash.fingerprint(item.title(), text),
                ContentQualityScorer.score(text)
        );
        QualityVerdict verdict = scorer.evaluate(item);
        if (!verdict.accepted()) {
            return reject(item, verdict.rejectReason());
        }
        Optional<RejectReason> duplicate = dedup.checkContent(item);
        if (duplicate.isPresent()) {
            return reject(item, duplicate.get());
        }

        item = classifier.classify(item);
        item = summarize(item);

        try {
            Optional<NewsItem> stored = store.accept(item, dedup.seenKeys(item), clock.instant());
            if (stored.isEmpty()) {
                return reject(item, RejectReason.DUPLICATE_URL);
            }
            NewsItem acceptedItem = stored.get();
            eventBus.publish(new ItemAccepted(
                    clock.instant(), acceptedItem.id(), acceptedItem.source(), acceptedItem.category().code(), acceptedItem.url()));
            return new Outcome(acceptedItem, null);
        } catch (StoreException e) {
            LOGGER.log(Level.WARNING, "Could not persist " + item.url(), e);
            return reject(item, RejectReason.PERSIST_FAILED);
        }
    }

    private NewsItem summarize(NewsItem item) {
        if (gateway == null || summaryMinChars <= 0 || !gateway.enabled(EnrichmentTask.SUMMARY)) {
            return item;
        }
        if (item.cleanText() == null || item.cleanText().length() < summaryMinChars) {
            return item;
        }
        return gateway.summarize(item).map(item::withSummary).orElse(item);
    }

    private Outcome reject(NewsItem item, RejectReason reason) {
        LOGGER.fine("Dropped " + item.url() + " from " + item.source() + ": " + reason.code());
        eventBus.publish(new ItemRejected(clock.instant(), item.source(), item.url(), reason.code()));
        if (reason != RejectReason.DUPLICATE_SEEN && reason != RejectReason.PERSIST_FAILED) {
            try {
                store.markSeen(dedup.seenKeys(item), clock.instant());
            } catch (StoreException e) {
                LOGGER.log(Level.WARNING, "Could not record seen keys for " + item.url(), e);
            }
        }
        return new Outcome(null, reason);
    }

    record Outcome(NewsItem accepted, RejectReason reason) {
    }
}
