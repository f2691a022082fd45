package com.newsrelay.collectors.config;

import java.time.Duration;

public record DedupSettings(
        Duration contentWindow,
        int simhashDistance,
        Duration titleWindow,
        double titleJaccard,
        int titleContainmentChars
) {
    public DedupSettings {
        contentWindow = CooldownSettings.orDefault(contentWindow, Duration.ofHours(48));
        simhashDistance = simhashDistance <= 0 ? 20 : simhashDistance;
        titleWindow = CooldownSettings.orDefault(titleWindow, Duration.ofHours(24));
        titleJaccard = titleJaccard <= 0 || titleJaccard > 1 ? 0.85 : titleJaccard;
        titleContainmentChars = titleContainmentChars <= 0 ? 30 : titleContainmentChars;
    }

    public static DedupSettings defaults() {
        return new DedupSettings(null, 0, null, 0, 0);
    }
}
