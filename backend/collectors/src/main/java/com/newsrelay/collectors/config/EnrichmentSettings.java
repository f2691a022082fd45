package com.newsrelay.collectors.config;

import com.newsrelay.collectors.enrich.EnrichmentTask;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

public record EnrichmentSettings(
        boolean enabled,
        Set<EnrichmentTask> tasks,
        Duration cacheTtl,
        BudgetSettings budget,
        int maxCallsPerCycle,
        int maxAttempts,
        Duration initialBackoff,
        Duration callTimeout,
        int maxInputChars,
        int summaryMinChars
) {
    public EnrichmentSettings {
        tasks = tasks == null || tasks.isEmpty() ? EnumSet.allOf(EnrichmentTask.class) : EnumSet.copyOf(tasks);
        cacheTtl = CooldownSettings.orDefault(cacheTtl, Duration.ofHours(72));
        budget = budget == null ? BudgetSettings.defaults() : budget;
        maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
        initialBackoff = CooldownSettings.orDefault(initialBackoff, Duration.ofMillis(800));
        callTimeout = CooldownSettings.orDefault(callTimeout, Duration.ofSeconds(10));
        maxInputChars = maxInputChars <= 0 ? 3200 : maxInputChars;
        summaryMinChars = Math.max(0, summaryMinChars);
    }

    public static EnrichmentSettings disabled() {
        return new EnrichmentSettings(false, null, null, null, 6, 0, null, null, 0, 0);
    }

    public static EnrichmentSettings enabledWith(BudgetSettings budget, int maxCallsPerCycle) {
        return new EnrichmentSettings(true, null, null, budget, maxCallsPerCycle, 0, null, null, 0, 0);
    }

    public boolean allows(EnrichmentTask task) {
        return enabled && tasks.contains(task);
    }
}
