package com.newsrelay.service.delivery;

import com.newsrelay.core.model.NewsItem;

import java.util.logging.Logger;

public class LoggingTransport implements MessageTransport {
    private static final Logger LOGGER = Logger.getLogger(LoggingTransport.class.getName());

    @Override
    public void send(String subscriberId, DeliveryMessage message) {
        NewsItem item = message.item();
        LOGGER.info("[" + subscriberId + "] " + item.title() + " " + item.url() + " " + message.tagLine());
    }
}
