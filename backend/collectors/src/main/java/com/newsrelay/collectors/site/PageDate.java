package com.newsrelay.collectors.site;

import com.newsrelay.core.model.PublishedConfidence;

import java.time.Instant;

public record PageDate(Instant publishedAt, PublishedConfidence confidence) {
    public static final PageDate UNKNOWN = new PageDate(null, PublishedConfidence.NONE);
}
