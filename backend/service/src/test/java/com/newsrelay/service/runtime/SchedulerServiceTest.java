package com.newsrelay.service.runtime;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-12T20:00:00Z"), ZoneOffset.UTC);

    @Test
    void runOnceAllRunsOnlyEnabledJobs() {
        AtomicInteger runsA = new AtomicInteger();
        AtomicInteger runsB = new AtomicInteger();

        SchedulerService scheduler = new SchedulerService(
                List.of(
                        new SchedulerService.ScheduledJob("a", runsA::incrementAndGet, Duration.ofMillis(10), true),
                        new SchedulerService.ScheduledJob("b", runsB::incrementAndGet, Duration.ofMillis(10), false)
                ),
                new EventBus(),
                CLOCK
        );

        List<SchedulerService.JobResult> results = scheduler.runOnceAll();
        assertEquals(1, results.size());
        assertEquals("a", results.get(0).name());
        assertEquals(1, runsA.get());
        assertEquals(0, runsB.get());
        scheduler.shutdown();
    }

    @Test
    void failingJobDoesNotBlockOthersAndRaisesAlert() {
        EventBus bus = new EventBus();
        List<AlertRaised> alerts = new CopyOnWriteArrayList<>();
        bus.subscribe(AlertRaised.class, alerts::add);
        AtomicInteger goodRuns = new AtomicInteger();

        SchedulerService scheduler = new SchedulerService(
                List.of(
                        new SchedulerService.ScheduledJob("bad", () -> {
                            throw new IllegalStateException("boom");
                        }, Duration.ofMillis(10), true),
                        new SchedulerService.ScheduledJob("good", goodRuns::incrementAndGet, Duration.ofMillis(10), true)
                ),
                bus,
                CLOCK
        );

        List<SchedulerService.JobResult> results = scheduler.runOnceAll();
        assertEquals(2, results.size());
        assertTrue(results.stream().anyMatch(result -> !result.success() && result.name().equals("bad")));
        assertTrue(results.stream().anyMatch(SchedulerService.JobResult::success));
        assertEquals(1, goodRuns.get());
        AlertRaised alert = alerts.get(0);
        assertTrue(alert.message().contains("Job run failed: bad - boom"));
        assertEquals("bad", alert.details().get("collector"));
        scheduler.shutdown();
    }

    @Test
    void shutdownStopsFutureRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledJob("scheduled", runs::incrementAndGet, Duration.ofMillis(5), true)),
                new EventBus(),
                CLOCK,
                5
        );

        scheduler.start();
        Thread.sleep(50);
        scheduler.shutdown();
        int shortlyAfterShutdown = runs.get();
        Thread.sleep(40);

        assertTrue(shortlyAfterShutdown > 0);
        // One already-submitted run may still finish.
        assertTrue(runs.get() <= shortlyAfterShutdown + 1);
    }

    @Test
    void repeatedRunOnceCompletesPredictably() {
        AtomicInteger runs = new AtomicInteger();
        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledJob("repeat", runs::incrementAndGet, Duration.ofMillis(10), true)),
                new EventBus(),
                CLOCK
        );

        for (int i = 0; i < 50; i++) {
            List<SchedulerService.JobResult> results = scheduler.runOnceAll();
            assertEquals(1, results.size());
            assertFalse(results.get(0).message().isBlank());
        }

        assertEquals(50, runs.get());
        scheduler.shutdown();
    }
}
