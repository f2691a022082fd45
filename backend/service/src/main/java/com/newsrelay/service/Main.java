package com.newsrelay.service;

import com.newsrelay.collectors.enrich.LlmService;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.service.config.ConfigLoader;
import com.newsrelay.service.config.PipelineConfig;
import com.newsrelay.service.delivery.LoggingTransport;
import com.newsrelay.service.http.HttpClientFactory;
import com.newsrelay.service.llm.ChatCompletionLlmService;
import com.newsrelay.service.runtime.NewsRelayRuntime;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("NEWSRELAY_CONFIG_DIR", "config"));
        Path dataDir = Path.of(env.getOrDefault("NEWSRELAY_DATA_DIR", "data"));

        PipelineConfig config = ConfigLoader.loadPipeline(configDir);
        List<SourceConfig> sources = ConfigLoader.loadSources(configDir);
        List<Subscriber> subscribers = ConfigLoader.loadSubscribers(configDir);

        Duration connectTimeout = config.collector().requestTimeout();
        HttpClient httpClient = HttpClientFactory.create(connectTimeout);
        HttpClient insecureClient = config.collector().allowInsecureFallback()
                ? HttpClientFactory.createInsecure(connectTimeout)
                : null;
        LlmService llmService = llmService(env, config, httpClient);

        NewsRelayRuntime runtime = new NewsRelayRuntime(
                config,
                sources,
                subscribers,
                dataDir,
                httpClient,
                insecureClient,
                llmService,
                new LoggingTransport(),
                Clock.systemUTC()
        );
        LOGGER.info("Starting with " + sources.size() + " sources and " + subscribers.size()
                + " subscribers; data in " + dataDir.toAbsolutePath());
        runtime.scheduler().start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static LlmService llmService(Map<String, String> env, PipelineConfig config, HttpClient httpClient) {
        String apiKey = env.get("LLM_API_KEY");
        if (!config.enrichment().enabled()) {
            return null;
        }
        if (apiKey == null || apiKey.isBlank()) {
            LOGGER.warning("Enrichment is enabled in config but LLM_API_KEY is not set; running without enrichment");
            return null;
        }
        return new ChatCompletionLlmService(httpClient, config.llm(), apiKey);
    }
}
