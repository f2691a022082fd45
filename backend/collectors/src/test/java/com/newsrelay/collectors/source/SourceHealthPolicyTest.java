package com.newsrelay.collectors.source;

import com.newsrelay.collectors.config.CooldownSettings;
import com.newsrelay.collectors.fetch.FetchErrorCode;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceFetchState;
import com.newsrelay.core.model.SourceTier;
import com.newsrelay.core.model.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceHealthPolicyTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    private final SourceHealthPolicy policy = new SourceHealthPolicy(CooldownSettings.defaults());
    private final SourceConfig plain = SourceConfig.feed("plain", "https://plain.example/rss", Category.RUSSIA);
    private final SourceConfig mirrored = new SourceConfig(
            "https://main.example/rss", "mirrored", Category.RUSSIA, SourceType.RSS, SourceTier.STANDARD,
            List.of("https://mirror.example/rss"), null, true);

    @Test
    void classifiedErrorsApplyFixedCooldowns() {
        SourceFetchState initial = SourceFetchState.initial("plain");

        assertEquals(NOW.plus(Duration.ofMinutes(10)), policy.onFailure(initial, plain, FetchErrorCode.http(429), NOW).nextFetchAt());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), policy.onFailure(initial, plain, FetchErrorCode.http(403), NOW).nextFetchAt());
        assertEquals(NOW.plus(Duration.ofHours(1)), policy.onFailure(initial, plain, FetchErrorCode.http(404), NOW).nextFetchAt());
    }

    @Test
    void unavailableCooldownOnlyForMirroredSources() {
        SourceFetchState mirroredState = policy.onFailure(SourceFetchState.initial("mirrored"), mirrored, FetchErrorCode.http(503), NOW);
        SourceFetchState plainState = policy.onFailure(SourceFetchState.initial("plain"), plain, FetchErrorCode.http(503), NOW);

        assertEquals(NOW.plus(Duration.ofMinutes(5)), mirroredState.nextFetchAt());
        assertEquals(0, mirroredState.errorStreak());
        assertNull(plainState.nextFetchAt());
        assertEquals(1, plainState.errorStreak());
        assertEquals("HTTP_503", plainState.lastErrorCode());
    }

    @Test
    void streakOverLimitWithinWindowTriggersCooldown() {
        SourceFetchState state = SourceFetchState.initial("plain");
        Instant at = NOW;
        for (int i = 0; i < 5; i++) {
            state = policy.onFailure(state, plain, FetchErrorCode.TIMEOUT, at);
            at = at.plusSeconds(60);
            assertFalse(state.inCooldown(at));
        }
        assertEquals(5, state.errorStreak());

        state = policy.onFailure(state, plain, FetchErrorCode.CONNECTION_ERROR, at);

        assertEquals(0, state.errorStreak());
        assertEquals(at.plus(Duration.ofMinutes(10)), state.nextFetchAt());
        assertTrue(state.inCooldown(at.plusSeconds(1)));
    }

    @Test
    void errorsOutsideWindowRestartStreak() {
        SourceFetchState state = SourceFetchState.initial("plain");
        state = policy.onFailure(state, plain, FetchErrorCode.TIMEOUT, NOW);
        state = policy.onFailure(state, plain, FetchErrorCode.TIMEOUT, NOW.plusSeconds(30));
        assertEquals(2, state.errorStreak());

        state = policy.onFailure(state, plain, FetchErrorCode.TIMEOUT, NOW.plus(Duration.ofMinutes(30)));

        assertEquals(1, state.errorStreak());
    }

    @Test
    void successResetsStreak() {
        SourceFetchState failed = policy.onFailure(SourceFetchState.initial("plain"), plain, FetchErrorCode.TIMEOUT, NOW);

        SourceFetchState ok = policy.onSuccess(failed, 200, NOW.plusSeconds(10));

        assertEquals(0, ok.errorStreak());
        assertEquals("200", ok.lastStatus());
        assertNull(ok.lastErrorCode());
        assertFalse(ok.inCooldown(NOW.plusSeconds(10)));
    }
}
