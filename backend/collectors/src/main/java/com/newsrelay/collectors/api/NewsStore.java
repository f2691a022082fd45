package com.newsrelay.collectors.api;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceFetchState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NewsStore {
    boolean isSeen(String key);

    void markSeen(Collection<String> keys, Instant at);

    boolean isChecksumRecent(String checksum, Instant since);

    List<NewsItem> acceptedSince(Instant since);

    List<NewsItem> acceptedAfter(long itemId, Instant acceptedSince);

    Optional<NewsItem> item(long id);

    Optional<NewsItem> accept(NewsItem item, Collection<String> seenKeys, Instant at);

    boolean rollback(long itemId);

    Optional<SourceFetchState> sourceState(String source);

    void putSourceState(SourceFetchState state);
}
