package com.newsrelay.service.lease;

import java.time.Duration;
import java.time.Instant;

public record StopStatus(boolean stopped, Instant expiresAt, Duration remaining, String reason, String by) {
    public static StopStatus running() {
        return new StopStatus(false, null, Duration.ZERO, null, null);
    }
}
