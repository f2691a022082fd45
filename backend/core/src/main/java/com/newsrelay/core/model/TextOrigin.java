package com.newsrelay.core.model;

public enum TextOrigin {
    FEED,
    SITE_RULE,
    GENERIC,
    AI_CLEANUP,
    TITLE_FALLBACK
}
