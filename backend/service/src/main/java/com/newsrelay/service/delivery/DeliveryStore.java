package com.newsrelay.service.delivery;

import com.newsrelay.core.model.DeliveryLogEntry;
import com.newsrelay.core.model.DeliveryState;

import java.time.Instant;
import java.util.List;

public interface DeliveryStore {
    DeliveryState deliveryState(String subscriberId);

    // Bumps the pause version even when the flag is unchanged.
    DeliveryState recordPauseTransition(String subscriberId, boolean paused, Instant at);

    boolean compareAndSetLastDelivered(String subscriberId, long expected, long next, Instant at);

    boolean insertDeliveryLog(DeliveryLogEntry entry);

    boolean removeDeliveryLog(String subscriberId, long itemId);

    boolean releaseFailedDelivery(String subscriberId, long itemId, Instant failedAt);

    List<DeliveryLogEntry> pendingRetries();

    boolean clearPendingRetry(String subscriberId, long itemId);

    boolean isDelivered(String subscriberId, long itemId);

    List<DeliveryLogEntry> deliveryLog(String subscriberId);
}
