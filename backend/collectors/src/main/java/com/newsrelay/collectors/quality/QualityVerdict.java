package com.newsrelay.collectors.quality;

import com.newsrelay.core.model.RejectReason;

public record QualityVerdict(double score, RejectReason rejectReason) {
    public boolean accepted() {
        return rejectReason == null;
    }
}
