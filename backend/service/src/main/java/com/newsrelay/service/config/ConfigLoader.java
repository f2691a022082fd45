package com.newsrelay.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static List<SourceConfig> loadSources(Path configDir) {
        Path path = configDir.resolve("sources.json");
        List<SourceConfig> sources = read(path, new TypeReference<>() {
        });
        Set<String> names = new HashSet<>();
        for (SourceConfig source : sources) {
            if (!names.add(source.source())) {
                throw new IllegalStateException("Duplicate source name '" + source.source() + "' in " + path);
            }
        }
        List<SourceConfig> enabled = sources.stream().filter(SourceConfig::enabled).toList();
        LOGGER.info("Loaded " + enabled.size() + " enabled sources of " + sources.size() + " from " + path);
        return enabled;
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        Path path = configDir.resolve("pipeline.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + "; using default pipeline settings");
            return PipelineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static List<Subscriber> loadSubscribers(Path configDir) {
        Path path = configDir.resolve("subscribers.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
