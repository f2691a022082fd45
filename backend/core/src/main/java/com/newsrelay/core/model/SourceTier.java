package com.newsrelay.core.model;

public enum SourceTier {
    STANDARD,
    HIGH_VOLUME,
    SOCIAL
}
