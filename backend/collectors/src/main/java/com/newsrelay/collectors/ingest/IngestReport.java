package com.newsrelay.collectors.ingest;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RejectReason;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record IngestReport(List<NewsItem> accepted, Map<RejectReason, Integer> rejected) {
    public IngestReport {
        accepted = accepted == null ? List.of() : List.copyOf(accepted);
        rejected = rejected == null || rejected.isEmpty() ? Map.of() : new EnumMap<>(rejected);
    }

    public int rejectedCount() {
        return rejected.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int rejected(RejectReason reason) {
        return rejected.getOrDefault(reason, 0);
    }
}
