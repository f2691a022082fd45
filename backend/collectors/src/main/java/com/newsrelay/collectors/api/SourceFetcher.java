package com.newsrelay.collectors.api;

import com.newsrelay.collectors.fetch.Deadline;
import com.newsrelay.collectors.fetch.FetchException;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceType;

public interface SourceFetcher {
    SourceType type();

    FetchOutcome fetch(SourceConfig source, CollectorContext ctx, Deadline deadline) throws FetchException;
}
