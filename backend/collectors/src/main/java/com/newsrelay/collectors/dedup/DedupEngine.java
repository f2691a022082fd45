package com.newsrelay.collectors.dedup;

import com.newsrelay.collectors.api.NewsStore;
import com.newsrelay.collectors.config.DedupSettings;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.util.HashingUtils;
import com.newsrelay.core.util.SimHash;
import com.newsrelay.core.util.TextNormalizer;
import com.newsrelay.core.util.UrlNormalizer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public class DedupEngine {
    private final NewsStore store;
    private final DedupSettings settings;
    private final Clock clock;

    public DedupEngine(NewsStore store, DedupSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public NewsItem withUrlKeys(NewsItem item) {
        return item.withUrlKeys(UrlNormalizer.normalize(item.url()), UrlNormalizer.urlHash(item.url()));
    }

    public List<String> seenKeys(NewsItem item) {
        List<String> keys = new ArrayList<>(3);
        if (item.guid() != null && !item.guid().isBlank()) {
            keys.add(guidKey(item.guid()));
        }
        keys.add(rawUrlKey(item.url()));
        String urlHash = item.urlHash() == null ? UrlNormalizer.urlHash(item.url()) : item.urlHash();
        keys.add(normalizedUrlKey(urlHash));
        return keys;
    }

    public Optional<RejectReason> checkSeen(NewsItem item) {
        if (item.guid() != null && !item.guid().isBlank() && store.isSeen(guidKey(item.guid()))) {
            return Optional.of(RejectReason.DUPLICATE_SEEN);
        }
        if (store.isSeen(rawUrlKey(item.url()))) {
            return Optional.of(RejectReason.DUPLICATE_SEEN);
        }
        String urlHash = item.urlHash() == null ? UrlNormalizer.urlHash(item.url()) : item.urlHash();
        if (store.isSeen(normalizedUrlKey(urlHash))) {
            return Optional.of(RejectReason.DUPLICATE_URL);
        }
        return Optional.empty();
    }

    public Optional<RejectReason> checkContent(NewsItem item) {
        Instant now = clock.instant();
        Instant contentSince = now.minus(settings.contentWindow());
        if (item.checksum() != null && store.isChecksumRecent(item.checksum(), contentSince)) {
            return Optional.of(RejectReason.DUPLICATE_CHECKSUM);
        }
        List<NewsItem> recent = store.acceptedSince(contentSince);
        if (item.simhash() != null) {
            for (NewsItem accepted : recent) {
                if (accepted.simhash() != null && SimHash.distance(item.simhash(), accepted.simhash()) <= settings.simhashDistance()) {
                    return Optional.of(RejectReason.DUPLICATE_SIMHASH);
                }
            }
        }
        Instant titleSince = now.minus(settings.titleWindow());
        List<NewsItem> recentTitles = settings.titleWindow().compareTo(settings.contentWindow()) <= 0
                ? recent.stream().filter(accepted -> accepted.acceptedAt() == null || !accepted.acceptedAt().isBefore(titleSince)).toList()
                : store.acceptedSince(titleSince);
        if (isTitleDuplicate(item.title(), recentTitles)) {
            return Optional.of(RejectReason.DUPLICATE_TITLE);
        }
        return Optional.empty();
    }

    boolean isTitleDuplicate(String title, List<NewsItem> recent) {
        Set<String> words = TextNormalizer.titleWords(title);
        if (words.isEmpty()) {
            return false;
        }
        String normalized = String.join(" ", words);
        for (NewsItem accepted : recent) {
            Set<String> otherWords = TextNormalizer.titleWords(accepted.title());
            if (otherWords.isEmpty()) {
                continue;
            }
            String other = String.join(" ", otherWords);
            if (normalized.equals(other)) {
                return true;
            }
            boolean ownShorter = normalized.length() <= other.length();
            String shorter = ownShorter ? normalized : other;
            String longer = ownShorter ? other : normalized;
            if (shorter.length() >= settings.titleContainmentChars() && longer.contains(shorter)) {
                return true;
            }
            if (TextNormalizer.jaccard(words, otherWords) >= settings.titleJaccard()) {
                return true;
            }
        }
        return false;
    }

    static String guidKey(String guid) {
        return "guid:" + guid.trim();
    }

    static String rawUrlKey(String url) {
        return "url:" + HashingUtils.sha256(url.trim());
    }

    static String normalizedUrlKey(String urlHash) {
        return "norm:" + urlHash;
    }
}
