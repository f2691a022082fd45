package com.newsrelay.service.runtime;

import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.service.config.PipelineConfig;
import com.newsrelay.service.delivery.DeliveryException;
import com.newsrelay.service.delivery.DeliveryMessage;
import com.newsrelay.service.delivery.MessageTransport;
import com.newsrelay.service.lease.InstanceLock;
import com.newsrelay.service.support.RecordingTransport;
import com.newsrelay.service.support.TestNews;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsPipelineTest {
    private static final List<Subscriber> SUBSCRIBERS = List.of(
            Subscriber.unfiltered("alice"),
            Subscriber.unfiltered("bob"),
            Subscriber.unfiltered("carol"),
            Subscriber.unfiltered("dave")
    );

    private HttpServer server;
    private ExecutorService serverExecutor;
    private NewsRelayRuntime runtime;
    private Path dataDir;
    private final AtomicInteger feedHits = new AtomicInteger();

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
        if (server != null) {
            server.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void cycleDeliversEachItemOnceAndResumeReplaysMissedItems() throws Exception {
        startFeed(null);
        RecordingTransport transport = new RecordingTransport();
        runtime = runtime(transport);
        runtime.deliveryEngine().pause("dave");

        assertEquals(3, runtime.pipeline().collectAndPublish());

        List<Long> ids = storedIds();
        assertEquals(3, ids.size());
        for (String subscriber : List.of("alice", "bob", "carol")) {
            assertEquals(ids, transport.itemsSentTo(subscriber));
        }
        assertTrue(transport.itemsSentTo("dave").isEmpty());

        assertEquals(0, runtime.pipeline().collectAndPublish());
        assertEquals(2, feedHits.get());
        assertEquals(9, transport.count());

        assertEquals(3, runtime.deliveryEngine().resume("dave"));
        assertEquals(ids, transport.itemsSentTo("dave"));
        assertEquals(0, runtime.deliveryEngine().resume("dave"));
        assertEquals(12, transport.count());

        assertEquals(3, runtime.diagnostics().acceptedTotal());
        assertEquals(3, runtime.eventStore().query(Instant.EPOCH, Optional.of("ItemAccepted"), 0).size());
        assertEquals(12, runtime.eventStore().query(Instant.EPOCH, Optional.of("ItemDelivered"), 0).size());
        assertEquals(2, runtime.eventStore().sourceHistory("test-feed", 10).size());
    }

    @Test
    void overlappingCycleReturnsImmediately() throws Exception {
        CountDownLatch requested = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        startFeed(() -> {
            requested.countDown();
            await(release);
        });
        runtime = runtime(new RecordingTransport());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> first = executor.submit(() -> runtime.pipeline().collectAndPublish());
            assertTrue(requested.await(5, TimeUnit.SECONDS));
            assertTrue(runtime.pipeline().cycleInFlight());

            assertEquals(0, runtime.pipeline().collectAndPublish());

            release.countDown();
            assertEquals(3, first.get(20, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdown();
        }
        assertEquals(1, feedHits.get());
    }

    @Test
    void stoppedCollectionSkipsTheWholeCycle() throws Exception {
        startFeed(null);
        runtime = runtime(new RecordingTransport());
        runtime.stopLease().stop(Duration.ofMinutes(5), "maintenance", "ops");

        assertEquals(0, runtime.pipeline().collectAndPublish());
        assertEquals(0, feedHits.get());

        runtime.stopLease().resume();
        assertEquals(3, runtime.pipeline().collectAndPublish());
    }

    @Test
    void stopDuringFanOutRollsBackUnpublishedItems() throws Exception {
        startFeed(null);
        RecordingTransport recorded = new RecordingTransport();
        AtomicBoolean stopRaised = new AtomicBoolean();
        MessageTransport stopping = new MessageTransport() {
            @Override
            public void send(String subscriberId, DeliveryMessage message) throws DeliveryException {
                recorded.send(subscriberId, message);
                if (stopRaised.compareAndSet(false, true)) {
                    runtime.stopLease().stop(Duration.ofMinutes(5), "incident", "ops");
                }
            }
        };
        runtime = runtime(stopping);

        assertEquals(1, runtime.pipeline().collectAndPublish());
        List<Long> kept = storedIds();
        assertEquals(1, kept.size());
        for (Subscriber subscriber : SUBSCRIBERS) {
            assertEquals(kept, recorded.itemsSentTo(subscriber.id()));
        }

        runtime.stopLease().resume();
        assertEquals(2, runtime.pipeline().collectAndPublish());
        assertEquals(3, storedIds().size());
        assertEquals(12, recorded.count());
        assertEquals(3, recorded.itemsSentTo("alice").size());
    }

    @Test
    void leaseHeldByAnotherInstanceSkipsTheCycle() throws Exception {
        startFeed(null);
        runtime = runtime(new RecordingTransport());
        InstanceLock other = new InstanceLock(dataDir.resolve("instance.lease"), Duration.ofMinutes(10), Clock.systemUTC());
        assertTrue(other.tryAcquire());

        assertEquals(0, runtime.pipeline().collectAndPublish());
        assertEquals(0, feedHits.get());

        other.release();
        assertEquals(3, runtime.pipeline().collectAndPublish());
        assertTrue(runtime.instanceLock().isHeld());
    }

    private NewsRelayRuntime runtime(MessageTransport transport) throws IOException {
        dataDir = Files.createTempDirectory("pipeline-data-");
        HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        SourceConfig feed = SourceConfig.feed("test-feed", url("/rss"), Category.RUSSIA);
        return new NewsRelayRuntime(
                PipelineConfig.defaults(),
                List.of(feed),
                SUBSCRIBERS,
                dataDir,
                http,
                http,
                null,
                transport,
                Clock.systemUTC()
        );
    }

    private List<Long> storedIds() {
        return runtime.store().acceptedSince(Instant.EPOCH).stream().map(NewsItem::id).toList();
    }

    private void startFeed(Runnable beforeResponse) throws IOException {
        String rss = TestNews.rssFeed(
                "https://news.example.ru",
                Instant.now().minus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS),
                TestNews.MOSCOW_TITLE, TestNews.MOSCOW_TEXT,
                TestNews.TULA_TITLE, TestNews.TULA_TEXT,
                TestNews.SCHOOL_TITLE, TestNews.SCHOOL_TEXT
        );
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/rss", exchange -> {
            feedHits.incrementAndGet();
            if (beforeResponse != null) {
                beforeResponse.run();
            }
            writeResponse(exchange, rss);
        });
        server.start();
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void writeResponse(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/rss+xml; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
