package com.newsrelay.collectors.quality;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.PublishedConfidence;
import com.newsrelay.core.model.RejectReason;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class FreshnessPolicy {
    private final Duration maxAge;
    private final boolean requirePublishedDate;

    public FreshnessPolicy(Duration maxAge, boolean requirePublishedDate) {
        this.maxAge = maxAge;
        this.requirePublishedDate = requirePublishedDate;
    }

    public Result apply(NewsItem item, Instant now) {
        if (item.publishedAt() == null || item.publishedConfidence() == PublishedConfidence.NONE) {
            if (requirePublishedDate) {
                return Result.reject(RejectReason.NO_PUBLISHED_DATE);
            }
            Instant surrogate = item.fetchedAt() == null ? now : item.fetchedAt();
            return Result.keep(item.withPublished(surrogate, PublishedConfidence.SURROGATE));
        }
        if (item.publishedConfidence() != PublishedConfidence.SURROGATE && item.publishedAt().isBefore(now.minus(maxAge))) {
            return Result.reject(RejectReason.OLD_PUBLISHED_AT);
        }
        return Result.keep(item);
    }

    public record Result(NewsItem item, RejectReason rejectReason) {
        static Result keep(NewsItem item) {
            return new Result(item, null);
        }

        static Result reject(RejectReason reason) {
            return new Result(null, reason);
        }

        public Optional<NewsItem> kept() {
            return Optional.ofNullable(item);
        }
    }
}
