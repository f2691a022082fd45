package com.newsrelay.service.delivery;

import java.time.Duration;

public record DeliverySettings(Duration replayWindow, int fanOutThreads) {
    public DeliverySettings {
        replayWindow = replayWindow == null || replayWindow.isNegative() ? Duration.ofHours(24) : replayWindow;
        fanOutThreads = fanOutThreads <= 0 ? 8 : fanOutThreads;
    }

    public static DeliverySettings defaults() {
        return new DeliverySettings(null, 0);
    }
}
