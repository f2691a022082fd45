package com.newsrelay.service.lease;

import java.time.Instant;

public record LeaseRecord(String ownerId, long pid, Instant acquiredAt, Instant expiresAt, String reason, String by) {
    public boolean expiredAt(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
