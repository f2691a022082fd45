package com.newsrelay.collectors.quality;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;
import com.newsrelay.core.model.TextOrigin;
import com.newsrelay.core.util.TextNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

public class ContentQualityScorer {
    static final double REFERENCE_LENGTH = 900.0;
    static final double REFERENCE_SENTENCES = 5.0;

    private final QualityProfiles profiles;

    public ContentQualityScorer(QualityProfiles profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles are required");
    }

    public static double score(String text) {
        String raw = text == null ? "" : text.trim();
        if (raw.isEmpty()) {
            return 0.0;
        }
        int sentenceCount = TextNormalizer.sentences(raw).size();
        double noiseRatio = Math.min(1.0, NoisePhrases.countIn(raw) / (double) Math.max(1, sentenceCount));

        List<String> lines = raw.lines().map(String::trim).filter(line -> !line.isEmpty()).toList();
        double repeatRatio = lines.isEmpty() ? 0.0 : 1.0 - (new HashSet<>(lines).size() / (double) lines.size());

        double lengthScore = Math.min(1.0, raw.length() / REFERENCE_LENGTH) * 0.5;
        double sentenceScore = Math.min(1.0, sentenceCount / REFERENCE_SENTENCES) * 0.3;
        double penalty = noiseRatio * 0.1 + repeatRatio * 0.1;
        return Math.max(0.0, Math.min(1.0, lengthScore + sentenceScore - penalty));
    }

    public QualityVerdict evaluate(NewsItem item) {
        QualityProfile profile = profiles.forTier(item.sourceTier());
        boolean titleFallback = item.textOrigin() == TextOrigin.TITLE_FALLBACK;
        int minLength = titleFallback ? profile.fallbackMinLength() : profile.minLength();
        double threshold = titleFallback ? profile.fallbackThreshold() : profile.threshold();

        String text = item.cleanText() == null ? "" : item.cleanText().trim();
        double score = score(text);
        if (text.length() < minLength) {
            return new QualityVerdict(score, RejectReason.TOO_SHORT);
        }
        if (score < threshold) {
            return new QualityVerdict(score, RejectReason.LOW_QUALITY);
        }
        return new QualityVerdict(score, null);
    }

    public QualityProfile profileFor(NewsItem item) {
        return profiles.forTier(item.sourceTier());
    }
}
