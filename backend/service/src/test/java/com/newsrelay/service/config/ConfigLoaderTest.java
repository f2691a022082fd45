package com.newsrelay.service.config;

import com.newsrelay.collectors.quality.QualityProfile;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceTier;
import com.newsrelay.core.model.SourceType;
import com.newsrelay.core.model.Subscriber;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsEnabledSourcesWithDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-sources-");
        Files.writeString(dir.resolve("sources.json"), """
                [
                  {"source":"tass","url":"https://tass.example/rss","category":"russia"},
                  {"source":"region","url":"https://region.example/news","category":"moscow_region","type":"HTML",
                   "linkSelector":"a.title","tier":"HIGH_VOLUME"},
                  {"source":"off","url":"https://off.example/rss","category":"world","enabled":false}
                ]
                """);

        List<SourceConfig> sources = ConfigLoader.loadSources(dir);

        assertEquals(2, sources.size());
        SourceConfig tass = sources.get(0);
        assertEquals(Category.RUSSIA, tass.category());
        assertEquals(SourceType.RSS, tass.type());
        assertEquals(SourceTier.STANDARD, tass.tier());
        assertTrue(tass.mirrors().isEmpty());
        SourceConfig region = sources.get(1);
        assertEquals(Category.MOSCOW_REGION, region.category());
        assertEquals(SourceType.HTML, region.type());
        assertEquals("a.title", region.linkSelector());
    }

    @Test
    void duplicateSourceNamesFailFast() throws Exception {
        Path dir = Files.createTempDirectory("config-duplicates-");
        Files.writeString(dir.resolve("sources.json"), """
                [
                  {"source":"tass","url":"https://tass.example/rss","category":"russia"},
                  {"source":"tass","url":"https://tass.example/other","category":"world","enabled":false}
                ]
                """);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(ex.getMessage().contains("Duplicate source name 'tass'"));
    }

    @Test
    void missingPipelineFileUsesDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-defaults-");

        PipelineConfig config = ConfigLoader.loadPipeline(dir);

        assertFalse(config.enrichment().enabled());
        assertEquals(Duration.ofHours(24), config.delivery().replayWindow());
        assertEquals(3, config.quality().size());
        assertEquals(Duration.ofMinutes(10), config.storage().instanceLeaseTtl());
        assertTrue(ConfigLoader.loadSubscribers(dir).isEmpty());
    }

    @Test
    void partialPipelineKeepsDefaultsForOmittedFields() throws Exception {
        Path dir = Files.createTempDirectory("config-partial-");
        Files.writeString(dir.resolve("pipeline.json"), """
                {
                  "collector": {"concurrency": 2, "requestTimeout": "PT5S"},
                  "delivery": {"replayWindow": "PT6H"},
                  "schedule": {"collectInterval": "PT1M"}
                }
                """);

        PipelineConfig config = ConfigLoader.loadPipeline(dir);

        assertEquals(2, config.collector().concurrency());
        assertEquals(Duration.ofSeconds(5), config.collector().requestTimeout());
        assertEquals(Duration.ofSeconds(60), config.collector().sourceTimeout());
        assertEquals(2, config.collector().retries());
        assertEquals(Duration.ofHours(6), config.delivery().replayWindow());
        assertEquals(Duration.ofMinutes(1), config.schedule().collectInterval());
        assertEquals(Duration.ofHours(1), config.schedule().cacheSweepInterval());
    }

    @Test
    void qualitySectionMustCoverEveryTier() throws Exception {
        Path dir = Files.createTempDirectory("config-quality-");
        Files.writeString(dir.resolve("pipeline.json"), """
                {"quality": {"STANDARD": {"minLength": 200, "threshold": 0.45, "fallbackMinLength": 25, "fallbackThreshold": 0.05}}}
                """);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadPipeline(dir));
        assertTrue(ex.getMessage().startsWith("Failed loading config from "));
    }

    @Test
    void malformedJsonFailsWithPath() throws Exception {
        Path dir = Files.createTempDirectory("config-malformed-");
        Files.writeString(dir.resolve("subscribers.json"), "[{");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSubscribers(dir));
        assertTrue(ex.getMessage().contains("subscribers.json"));
    }

    @Test
    void shippedConfigurationLoads() {
        Path dir = Path.of("../../config");

        List<SourceConfig> sources = ConfigLoader.loadSources(dir);
        PipelineConfig pipeline = ConfigLoader.loadPipeline(dir);
        List<Subscriber> subscribers = ConfigLoader.loadSubscribers(dir);

        assertEquals(10, sources.size());
        assertTrue(sources.stream().noneMatch(source -> source.source().equals("mash")));
        QualityProfile highVolume = pipeline.quality().get(SourceTier.HIGH_VOLUME);
        assertEquals(300, highVolume.minLength());
        assertEquals(8, pipeline.delivery().fanOutThreads());
        assertEquals(3, subscribers.size());
        assertEquals(Set.of(Category.MOSCOW, Category.MOSCOW_REGION), subscribers.get(1).categories());
        assertTrue(subscribers.get(1).enabledSources().isEmpty());
    }
}
