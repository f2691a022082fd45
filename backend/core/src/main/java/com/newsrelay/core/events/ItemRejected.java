package com.newsrelay.core.events;

import java.time.Instant;

public record ItemRejected(Instant timestamp, String source, String url, String reason) implements Event {
    @Override
    public String type() {
        return "ItemRejected";
    }
}
