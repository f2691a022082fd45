package com.newsrelay.service.lease;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongPredicate;
import java.util.logging.Logger;

public class InstanceLock implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(InstanceLock.class.getName());

    private final LeaseFile leaseFile;
    private final String ownerId;
    private final long pid;
    private final Duration ttl;
    private final Clock clock;
    private final LongPredicate processAlive;

    public InstanceLock(Path file, Duration ttl, Clock clock) {
        this(file, UUID.randomUUID().toString(), ProcessHandle.current().pid(), ttl, clock, InstanceLock::isProcessAlive);
    }

    InstanceLock(Path file, String ownerId, long pid, Duration ttl, Clock clock, LongPredicate processAlive) {
        this.leaseFile = new LeaseFile(file);
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId is required");
        this.pid = pid;
        this.ttl = Objects.requireNonNull(ttl, "ttl is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.processAlive = Objects.requireNonNull(processAlive, "processAlive is required");
    }

    public String ownerId() {
        return ownerId;
    }

    public boolean tryAcquire() {
        return leaseFile.update(current -> {
            Instant now = clock.instant();
            if (current.isPresent() && !ownedByMe(current.get()) && !takeable(current.get(), now)) {
                return LeaseFile.Update.keep(false);
            }
            Instant acquiredAt = current.filter(this::ownedByMe).map(LeaseRecord::acquiredAt).orElse(now);
            if (current.isPresent() && !ownedByMe(current.get())) {
                LOGGER.info("Taking over instance lease from " + current.get().ownerId() + " (pid " + current.get().pid() + ")");
            }
            return LeaseFile.Update.put(true, new LeaseRecord(ownerId, pid, acquiredAt, now.plus(ttl), null, null));
        });
    }

    public boolean isHeld() {
        Optional<LeaseRecord> current = leaseFile.read();
        return current.isPresent() && ownedByMe(current.get()) && !current.get().expiredAt(clock.instant());
    }

    public Optional<LeaseRecord> current() {
        return leaseFile.read();
    }

    public void release() {
        boolean released = leaseFile.update(current -> current.isPresent() && ownedByMe(current.get())
                ? LeaseFile.Update.delete(true)
                : LeaseFile.Update.keep(false));
        if (released) {
            LOGGER.info("Released instance lease " + leaseFile.path());
        }
    }

    @Override
    public void close() {
        release();
    }

    private boolean ownedByMe(LeaseRecord record) {
        return ownerId.equals(record.ownerId());
    }

    private boolean takeable(LeaseRecord record, Instant now) {
        return record.expiredAt(now) || !processAlive.test(record.pid());
    }

    private static boolean isProcessAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
