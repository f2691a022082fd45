package com.newsrelay.collectors.rss;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.FetchOutcome;
import com.newsrelay.collectors.api.SourceFetcher;
import com.newsrelay.collectors.fetch.Deadline;
import com.newsrelay.collectors.fetch.FetchErrorCode;
import com.newsrelay.collectors.fetch.FetchException;
import com.newsrelay.collectors.fetch.FetchResponse;
import com.newsrelay.collectors.source.DateParsing;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.PublishedConfidence;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceType;
import com.newsrelay.core.util.TextNormalizer;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class RssSourceFetcher implements SourceFetcher {
    @Override
    public SourceType type() {
        return SourceType.RSS;
    }

    @Override
    public FetchOutcome fetch(SourceConfig source, CollectorContext ctx, Deadline deadline) throws FetchException {
        FetchResponse response = ctx.fetcher().get(source.url(), deadline, ctx.settings().allowInsecureFallback());
        if (response.notModified()) {
            return FetchOutcome.notModifiedOutcome();
        }
        ParsedFeed feed = RssFeedParser.parse(response.body());
        if (feed.invalidXml()) {
            throw new FetchException(FetchErrorCode.PARSE_ERROR, "Invalid RSS/Atom XML for source " + source.source());
        }
        Instant fetchedAt = ctx.clock().instant();
        List<NewsItem> items = new ArrayList<>();
        List<FetchOutcome.DroppedEntry> dropped = new ArrayList<>();
        for (FeedEntry entry : feed.entries()) {
            String title = TextNormalizer.collapseWhitespace(entry.title());
            String link = resolve(response.finalUri(), entry.link());
            if (title.isEmpty() || link.isEmpty()) {
                continue;
            }
            Instant publishedAt = fetchedAt;
            PublishedConfidence confidence = PublishedConfidence.SURROGATE;
            if (entry.rawDate() != null && !entry.rawDate().isBlank()) {
                Optional<Instant> parsed = DateParsing.parse(entry.rawDate());
                if (parsed.isEmpty()) {
                    dropped.add(new FetchOutcome.DroppedEntry(link, RejectReason.PARSE_DATE_FAILED));
                    continue;
                }
                publishedAt = parsed.get();
                confidence = PublishedConfidence.HIGH;
            }
            items.add(NewsItem.candidate(source, entry.guid(), link, title, entry.summary(), publishedAt, confidence, fetchedAt));
        }
        return FetchOutcome.of(items, dropped);
    }

    private static String resolve(URI base, String link) {
        String trimmed = link == null ? "" : link.trim();
        if (trimmed.isEmpty() || base == null) {
            return trimmed;
        }
        try {
            return base.resolve(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return trimmed;
        }
    }
}
