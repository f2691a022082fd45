package com.newsrelay.collectors.api;

@FunctionalInterface
public interface StopSignal {
    StopSignal NEVER = () -> false;

    boolean isStopped();
}
