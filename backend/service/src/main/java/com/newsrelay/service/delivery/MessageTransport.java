package com.newsrelay.service.delivery;

@FunctionalInterface
public interface MessageTransport {
    void send(String subscriberId, DeliveryMessage message) throws DeliveryException;
}
