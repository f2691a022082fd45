package com.newsrelay.collectors.quality;

import com.newsrelay.core.model.SourceTier;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class QualityProfiles {
    private final EnumMap<SourceTier, QualityProfile> profiles;

    private QualityProfiles(EnumMap<SourceTier, QualityProfile> profiles) {
        this.profiles = profiles;
    }

    public static QualityProfiles defaults() {
        EnumMap<SourceTier, QualityProfile> defaults = new EnumMap<>(SourceTier.class);
        defaults.put(SourceTier.STANDARD, new QualityProfile(200, 0.45, 25, 0.05));
        defaults.put(SourceTier.HIGH_VOLUME, new QualityProfile(300, 0.55, 40, 0.08));
        defaults.put(SourceTier.SOCIAL, new QualityProfile(80, 0.25, 20, 0.03));
        return new QualityProfiles(defaults);
    }

    public static QualityProfiles of(Map<SourceTier, QualityProfile> configured) {
        Objects.requireNonNull(configured, "profiles are required");
        EnumMap<SourceTier, QualityProfile> copy = new EnumMap<>(SourceTier.class);
        for (SourceTier tier : SourceTier.values()) {
            QualityProfile profile = configured.get(tier);
            if (profile == null) {
                throw new IllegalArgumentException("Missing quality profile for tier " + tier);
            }
            copy.put(tier, profile);
        }
        return new QualityProfiles(copy);
    }

    public QualityProfile forTier(SourceTier tier) {
        return profiles.get(tier == null ? SourceTier.STANDARD : tier);
    }

    public Map<SourceTier, QualityProfile> asMap() {
        return Map.copyOf(profiles);
    }
}
