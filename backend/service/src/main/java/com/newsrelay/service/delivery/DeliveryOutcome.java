package com.newsrelay.service.delivery;

public enum DeliveryOutcome {
    DELIVERED,
    PAUSED,
    ALREADY_DELIVERED,
    FILTERED,
    PAUSE_RACE,
    DUPLICATE,
    SEND_FAILED,
    STORE_FAILED
}
