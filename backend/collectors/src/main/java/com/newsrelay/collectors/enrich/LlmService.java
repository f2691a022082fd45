package com.newsrelay.collectors.enrich;

import java.util.Map;

public interface LlmService {
    LlmResponse call(EnrichmentTask task, String payload, Map<String, Object> params) throws LlmCallException;
}
