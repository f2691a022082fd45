package com.newsrelay.service.store;

import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.SourceFetched;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());
    private static final long DEFAULT_MAX_BYTES = 16L * 1024 * 1024;

    private final Path file;
    private final long maxBytes;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_MAX_BYTES);
    }

    public JsonlEventStore(Path file, long maxBytes) {
        this.file = file;
        this.maxBytes = maxBytes <= 0 ? DEFAULT_MAX_BYTES : maxBytes;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            rotateIfNeeded();
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        List<Event> events = readMatching(event -> !event.timestamp().isBefore(since)
                && (type.isEmpty() || type.get().equals(event.type())));
        return tail(events, limit);
    }

    public List<SourceFetched> sourceHistory(String source, int limit) {
        List<SourceFetched> fetches = new ArrayList<>();
        for (Event event : readMatching(event -> event instanceof SourceFetched fetched && fetched.source().equals(source))) {
            fetches.add((SourceFetched) event);
        }
        return tail(fetches, limit);
    }

    private List<Event> readMatching(Predicate<Event> filter) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<Event> events = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid JSONL event at " + file + ":" + lineNumber, decodeError);
                }
                if (filter.test(event)) {
                    events.add(event);
                }
            }
            return events;
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events in " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void rotateIfNeeded() throws IOException {
        if (Files.exists(file) && Files.size(file) >= maxBytes) {
            Path rotated = file.resolveSibling(file.getFileName() + ".1");
            Files.move(file, rotated, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Rotated event log to " + rotated);
        }
    }

    private static <T> List<T> tail(List<T> values, int limit) {
        if (limit <= 0 || values.size() <= limit) {
            return values;
        }
        return new ArrayList<>(values.subList(values.size() - limit, values.size()));
    }
}
