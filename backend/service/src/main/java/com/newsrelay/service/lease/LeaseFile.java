package com.newsrelay.service.lease;

import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

final class LeaseFile {
    private static final Logger LOGGER = Logger.getLogger(LeaseFile.class.getName());

    private final Path file;
    private final Path lockFile;

    LeaseFile(Path file) {
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
    }

    Path path() {
        return file;
    }

    <T> T update(Function<Optional<LeaseRecord>, Update<T>> update) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                Update<T> result = update.apply(readUnlocked());
                if (result.write()) {
                    if (result.next().isPresent()) {
                        writeUnlocked(result.next().get());
                    } else {
                        Files.deleteIfExists(file);
                    }
                }
                return result.value();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed updating lease " + file, e);
        }
    }

    Optional<LeaseRecord> read() {
        try {
            return readUnlocked();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading lease " + file, e);
        }
    }

    private Optional<LeaseRecord> readUnlocked() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        String json = Files.readString(file, StandardCharsets.UTF_8);
        if (json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonUtils.objectMapper().readValue(json, LeaseRecord.class));
        } catch (IOException e) {
            LOGGER.warning("Ignoring unreadable lease " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void writeUnlocked(LeaseRecord record) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, JsonUtils.objectMapper().writeValueAsString(record), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    record Update<T>(T value, boolean write, Optional<LeaseRecord> next) {
        static <T> Update<T> keep(T value) {
            return new Update<>(value, false, Optional.empty());
        }

        static <T> Update<T> put(T value, LeaseRecord next) {
            return new Update<>(value, true, Optional.of(next));
        }

        static <T> Update<T> delete(T value) {
            return new Update<>(value, true, Optional.empty());
        }
    }
}
