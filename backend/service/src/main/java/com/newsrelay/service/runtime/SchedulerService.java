package com.newsrelay.service.runtime;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledJob> jobs;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(daemon("scheduler-timer"));
    private final ExecutorService jobExecutor = Executors.newCachedThreadPool(daemon("scheduler-job"));

    public SchedulerService(List<ScheduledJob> jobs, EventBus eventBus, Clock clock) {
        this(jobs, eventBus, clock, 100);
    }

    SchedulerService(List<ScheduledJob> jobs, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.jobs = List.copyOf(jobs);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledJob job : jobs) {
            if (!job.enabled()) {
                LOGGER.info("Job " + job.name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, job.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> jobExecutor.submit(() -> runJobSafely(job)),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info("Scheduled " + job.name() + " every " + Duration.ofMillis(intervalMillis));
        }
    }

    public List<JobResult> runOnceAll() {
        List<CompletableFuture<JobResult>> runs = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (!job.enabled()) {
                continue;
            }
            runs.add(CompletableFuture.supplyAsync(() -> runJobSafely(job), jobExecutor));
        }
        CompletableFuture.allOf(runs.toArray(CompletableFuture[]::new)).join();
        return runs.stream().map(CompletableFuture::join).toList();
    }

    public void shutdown() {
        timerExecutor.shutdown();
        jobExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            jobExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledJob> scheduledJobs() {
        return jobs;
    }

    private JobResult runJobSafely(ScheduledJob job) {
        try {
            job.task().run();
            return new JobResult(job.name(), true, "ok");
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Job " + job.name() + " failed", ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "collector",
                    "Job run failed: " + job.name() + " - " + ex.getMessage(),
                    Map.of("collector", job.name())
            ));
            return new JobResult(job.name(), false, "Job run failed: " + job.name());
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger ids = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + ids.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record ScheduledJob(String name, Runnable task, Duration interval, boolean enabled) {
        public ScheduledJob {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(task, "task is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }

    public record JobResult(String name, boolean success, String message) {
    }
}
