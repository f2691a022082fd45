package com.newsrelay.service.delivery;

import com.newsrelay.core.model.Subscriber;

import java.util.List;

public class StaticSubscriberDirectory implements SubscriberDirectory {
    private final List<Subscriber> subscribers;

    public StaticSubscriberDirectory(List<Subscriber> subscribers) {
        this.subscribers = List.copyOf(subscribers);
    }

    @Override
    public List<Subscriber> subscribers() {
        return subscribers;
    }
}
