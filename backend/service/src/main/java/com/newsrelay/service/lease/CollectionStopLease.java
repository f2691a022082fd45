package com.newsrelay.service.lease;

import com.newsrelay.collectors.api.StopSignal;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class CollectionStopLease implements StopSignal {
    private static final Logger LOGGER = Logger.getLogger(CollectionStopLease.class.getName());

    public static final Duration MIN_TTL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final LeaseFile leaseFile;
    private final Clock clock;

    public CollectionStopLease(Path file, Clock clock) {
        this.leaseFile = new LeaseFile(file);
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public StopStatus stop(Duration ttl, String reason, String by) {
        Duration effective = ttl == null ? DEFAULT_TTL : (ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl);
        Instant now = clock.instant();
        LeaseRecord record = new LeaseRecord("stop", ProcessHandle.current().pid(), now, now.plus(effective), reason, by);
        leaseFile.update(current -> LeaseFile.Update.put(null, record));
        LOGGER.warning("Collection stopped for " + effective + " by " + by + ": " + reason);
        return toStatus(record, now);
    }

    public void resume() {
        leaseFile.update(current -> LeaseFile.Update.delete(null));
        LOGGER.info("Collection stop lease cleared");
    }

    public StopStatus status() {
        Instant now = clock.instant();
        return readActive(now).map(record -> toStatus(record, now)).orElse(StopStatus.running());
    }

    @Override
    public boolean isStopped() {
        try {
            return readActive(clock.instant()).isPresent();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Could not read stop lease " + leaseFile.path(), e);
            return false;
        }
    }

    private Optional<LeaseRecord> readActive(Instant now) {
        return leaseFile.read().filter(record -> !record.expiredAt(now));
    }

    private static StopStatus toStatus(LeaseRecord record, Instant now) {
        return new StopStatus(true, record.expiresAt(), Duration.between(now, record.expiresAt()), record.reason(), record.by());
    }
}
