package com.newsrelay.service.delivery;

import com.newsrelay.core.model.Subscriber;

import java.util.List;
import java.util.Optional;

public interface SubscriberDirectory {
    List<Subscriber> subscribers();

    default Optional<Subscriber> subscriber(String subscriberId) {
        return subscribers().stream().filter(subscriber -> subscriber.id().equals(subscriberId)).findFirst();
    }
}
