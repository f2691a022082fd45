package com.newsrelay.collectors.support;

import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.collectors.enrich.LlmCallException;
import com.newsrelay.collectors.enrich.LlmResponse;
import com.newsrelay.collectors.enrich.LlmService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers per task. Tasks without an answer fail with a 500.
 */
public class StubLlmService implements LlmService {
    private final Map<EnrichmentTask, LlmResponse> answers = new ConcurrentHashMap<>();
    private final List<EnrichmentTask> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresBeforeSuccess = new AtomicInteger();

    public StubLlmService answer(EnrichmentTask task, String text) {
        answers.put(task, new LlmResponse(text, 100, 20));
        return this;
    }

    public StubLlmService answer(EnrichmentTask task, LlmResponse response) {
        answers.put(task, response);
        return this;
    }

    public StubLlmService failFirst(int count) {
        failuresBeforeSuccess.set(count);
        return this;
    }

    public List<EnrichmentTask> calls() {
        return List.copyOf(calls);
    }

    public long callCount(EnrichmentTask task) {
        return calls.stream().filter(task::equals).count();
    }

    @Override
    public LlmResponse call(EnrichmentTask task, String payload, Map<String, Object> params) throws LlmCallException {
        calls.add(task);
        if (failuresBeforeSuccess.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
            throw new LlmCallException("upstream overloaded", 503);
        }
        LlmResponse response = answers.get(task);
        if (response == null) {
            throw new LlmCallException("no answer for " + task.code(), 500);
        }
        return response;
    }
}
