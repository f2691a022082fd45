package com.newsrelay.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record NewsItem(
        Long id,
        String guid,
        String url,
        String title,
        String source,
        SourceType sourceType,
        SourceTier sourceTier,
        Category category,
        String payload,
        String rawText,
        String cleanText,
        TextOrigin textOrigin,
        String checksum,
        Long simhash,
        String urlNormalized,
        String urlHash,
        Instant publishedAt,
        PublishedConfidence publishedConfidence,
        double qualityScore,
        List<String> hashtags,
        String summary,
        Instant fetchedAt,
        Instant acceptedAt
) {
    public NewsItem {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(category, "category is required");
        sourceType = sourceType == null ? SourceType.RSS : sourceType;
        sourceTier = sourceTier == null ? SourceTier.STANDARD : sourceTier;
        publishedConfidence = publishedConfidence == null ? PublishedConfidence.NONE : publishedConfidence;
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    public static NewsItem candidate(
            SourceConfig source,
            String guid,
            String url,
            String title,
            String payload,
            Instant publishedAt,
            PublishedConfidence confidence,
            Instant fetchedAt
    ) {
        return new NewsItem(
                null, guid, url, title, source.source(), source.type(), source.tier(), source.category(),
                payload, null, null, null, null, null, null, null,
                publishedAt, confidence, 0.0, List.of(), null, fetchedAt, null
        );
    }

    public NewsItem withText(String nextRawText, String nextCleanText, TextOrigin origin) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, category,
                null, nextRawText, nextCleanText, origin, checksum, simhash, urlNormalized, urlHash,
                publishedAt, publishedConfidence, qualityScore, hashtags, summary, fetchedAt, acceptedAt
        );
    }

    public NewsItem withUrlKeys(String nextUrlNormalized, String nextUrlHash) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, category,
                payload, rawText, cleanText, textOrigin, checksum, simhash, nextUrlNormalized, nextUrlHash,
                publishedAt, publishedConfidence, qualityScore, hashtags, summary, fetchedAt, acceptedAt
        );
    }

    public NewsItem withFingerprints(String nextChecksum, long nextSimhash, double nextQualityScore) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, category,
                payload, rawText, cleanText, textOrigin, nextChecksum, nextSimhash, urlNormalized, urlHash,
                publishedAt, publishedConfidence, nextQualityScore, hashtags, summary, fetchedAt, acceptedAt
        );
    }

    public NewsItem withPublished(Instant nextPublishedAt, PublishedConfidence nextConfidence) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, category,
                payload, rawText, cleanText, textOrigin, checksum, simhash, urlNormalized, urlHash,
                nextPublishedAt, nextConfidence, qualityScore, hashtags, summary, fetchedAt, acceptedAt
        );
    }

    public NewsItem withClassification(Category nextCategory, List<String> nextHashtags) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, nextCategory,
                payload, rawText, cleanText, textOrigin, checksum, simhash, urlNormalized, urlHash,
                publishedAt, publishedConfidence, qualityScore, nextHashtags, summary, fetchedAt, acceptedAt
        );
    }

    public NewsItem withSummary(String nextSummary) {
        return new NewsItem(
                id, guid, url, title, source, sourceType, sourceTier, category,
                payload, rawText, cleanText, textOrigin, checksum, simhash, urlNormalized, urlHash,
                publishedAt, publishedConfidence, qualityScore, hashtags, nextSummary, fetchedAt, acceptedAt
        );
    }

    public NewsItem accepted(long assignedId, Instant at) {
        return new NewsItem(
                assignedId, guid, url, title, source, sourceType, sourceTier, category,
                null, rawText, cleanText, textOrigin, checksum, simhash, urlNormalized, urlHash,
                publishedAt, publishedConfidence, qualityScore, hashtags, summary, fetchedAt, at
        );
    }

    public String tagLine() {
        return String.join(" ", hashtags);
    }
}
