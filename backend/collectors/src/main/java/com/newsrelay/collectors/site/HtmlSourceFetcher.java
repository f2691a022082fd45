package com.newsrelay.collectors.site;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.api.FetchOutcome;
import com.newsrelay.collectors.api.SourceFetcher;
import com.newsrelay.collectors.fetch.Deadline;
import com.newsrelay.collectors.fetch.FetchException;
import com.newsrelay.collectors.fetch.FetchResponse;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceType;
import com.newsrelay.core.util.HtmlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class HtmlSourceFetcher implements SourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(HtmlSourceFetcher.class.getName());

    @Override
    public SourceType type() {
        return SourceType.HTML;
    }

    @Override
    public FetchOutcome fetch(SourceConfig source, CollectorContext ctx, Deadline deadline) throws FetchException {
        boolean allowInsecure = ctx.settings().allowInsecureFallback();
        FetchResponse listingResponse = ctx.fetcher().get(source.url(), deadline, allowInsecure);
        if (listingResponse.notModified()) {
            return FetchOutcome.notModifiedOutcome();
        }
        Document listing = Jsoup.parse(listingResponse.body(), listingResponse.finalUri().toString());
        List<String> links = HtmlListingParser.articleLinks(listing, source.linkSelector(), ctx.settings().maxArticlesPerSource());

        List<NewsItem> items = new ArrayList<>();
        for (String link : links) {
            if (deadline.expired()) {
                LOGGER.info("Deadline reached for " + source.source() + " after " + items.size() + " of " + links.size() + " articles");
                break;
            }
            try {
                FetchResponse article = ctx.fetcher().get(link, deadline, allowInsecure);
                if (article.notModified() || article.body().isBlank()) {
                    continue;
                }
                Document page = Jsoup.parse(article.body(), article.finalUri().toString());
                String title = HtmlUtils.extractTitle(page).orElse("");
                if (title.isEmpty()) {
                    continue;
                }
                PageDate date = PageDates.extract(page, link);
                Instant fetchedAt = ctx.clock().instant();
                items.add(NewsItem.candidate(source, null, link, title, article.body(), date.publishedAt(), date.confidence(), fetchedAt));
            } catch (FetchException e) {
                LOGGER.fine("Skipping article " + link + " of " + source.source() + ": " + e.code());
            }
        }
        return FetchOutcome.of(items, List.of());
    }
}
