package com.newsrelay.service.delivery;

import com.newsrelay.core.model.NewsItem;

import java.util.Objects;

public record DeliveryMessage(NewsItem item, String tagLine) {
    public DeliveryMessage {
        Objects.requireNonNull(item, "item is required");
        tagLine = tagLine == null ? "" : tagLine;
    }

    public static DeliveryMessage of(NewsItem item) {
        return new DeliveryMessage(item, item.tagLine());
    }
}
