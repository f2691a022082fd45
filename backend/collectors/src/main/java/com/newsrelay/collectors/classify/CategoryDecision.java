package com.newsrelay.collectors.classify;

import com.newsrelay.core.model.Category;

public record CategoryDecision(Category category, boolean ambiguous) {
}
