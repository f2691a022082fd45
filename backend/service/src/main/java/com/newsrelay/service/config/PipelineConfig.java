package com.newsrelay.service.config;

import com.newsrelay.collectors.config.CollectorSettings;
import com.newsrelay.collectors.config.DedupSettings;
import com.newsrelay.collectors.config.EnrichmentSettings;
import com.newsrelay.collectors.quality.QualityProfile;
import com.newsrelay.collectors.quality.QualityProfiles;
import com.newsrelay.core.model.SourceTier;
import com.newsrelay.service.delivery.DeliverySettings;
import com.newsrelay.service.llm.LlmSettings;

import java.util.Map;

public record PipelineConfig(
        CollectorSettings collector,
        Map<SourceTier, QualityProfile> quality,
        DedupSettings dedup,
        EnrichmentSettings enrichment,
        DeliverySettings delivery,
        StorageSettings storage,
        LlmSettings llm,
        ScheduleSettings schedule
) {
    public PipelineConfig {
        collector = collector == null ? CollectorSettings.defaults() : collector;
        quality = quality == null ? QualityProfiles.defaults().asMap() : QualityProfiles.of(quality).asMap();
        dedup = dedup == null ? DedupSettings.defaults() : dedup;
        enrichment = enrichment == null ? EnrichmentSettings.disabled() : enrichment;
        delivery = delivery == null ? DeliverySettings.defaults() : delivery;
        storage = storage == null ? StorageSettings.defaults() : storage;
        llm = llm == null ? LlmSettings.defaults() : llm;
        schedule = schedule == null ? ScheduleSettings.defaults() : schedule;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null, null, null, null);
    }

    public QualityProfiles qualityProfiles() {
        return QualityProfiles.of(quality);
    }
}
