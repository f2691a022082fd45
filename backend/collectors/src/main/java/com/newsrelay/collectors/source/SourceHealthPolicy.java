package com.newsrelay.collectors.source;

import com.newsrelay.collectors.config.CooldownSettings;
import com.newsrelay.collectors.fetch.FetchErrorCode;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceFetchState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public class SourceHealthPolicy {
    private final CooldownSettings settings;

    public SourceHealthPolicy(CooldownSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public SourceFetchState onSuccess(SourceFetchState previous, int status, Instant at) {
        return new SourceFetchState(
                previous.source(),
                at.plus(settings.minFetchInterval()),
                at,
                String.valueOf(status),
                0,
                previous.lastErrorAt(),
                null
        );
    }

    public SourceFetchState onFailure(SourceFetchState previous, SourceConfig source, FetchErrorCode code, Instant at) {
        Duration fixedCooldown = fixedCooldown(source, code);
        if (fixedCooldown != null) {
            return failed(previous, code, at, 0, at.plus(fixedCooldown));
        }
        boolean withinWindow = previous.lastErrorAt() != null
                && !previous.lastErrorAt().isBefore(at.minus(settings.streakWindow()));
        int streak = withinWindow ? previous.errorStreak() + 1 : 1;
        if (streak > settings.streakLimit()) {
            return failed(previous, code, at, 0, at.plus(settings.streakCooldown()));
        }
        return failed(previous, code, at, streak, null);
    }

    Duration fixedCooldown(SourceConfig source, FetchErrorCode code) {
        if (code.isHttp(429)) {
            return settings.rateLimited();
        }
        if (code.isHttp(403)) {
            return settings.forbidden();
        }
        if (code.isHttp(404)) {
            return settings.notFound();
        }
        if (code.isHttp(503) && !source.mirrors().isEmpty()) {
            return settings.mirrorUnavailable();
        }
        return null;
    }

    private static SourceFetchState failed(SourceFetchState previous, FetchErrorCode code, Instant at, int streak, Instant nextFetchAt) {
        return new SourceFetchState(
                previous.source(),
                nextFetchAt,
                at,
                code.value(),
                streak,
                at,
                code.value()
        );
    }
}
