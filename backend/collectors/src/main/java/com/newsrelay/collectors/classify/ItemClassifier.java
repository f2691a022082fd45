package com.newsrelay.collectors.classify;

import com.newsrelay.collectors.enrich.EnrichmentGateway;
import com.newsrelay.collectors.enrich.EnrichmentTask;
import com.newsrelay.core.model.Category;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.util.TextNormalizer;

import java.util.Objects;

public class ItemClassifier {
    private static final int VERIFY_TEXT_CHARS = 1500;

    private final CategoryClassifier categoryClassifier;
    private final HashtagClassifier hashtagClassifier;
    private final EnrichmentGateway gateway;

    public ItemClassifier(CategoryClassifier categoryClassifier, HashtagClassifier hashtagClassifier, EnrichmentGateway gateway) {
        this.categoryClassifier = Objects.requireNonNull(categoryClassifier, "categoryClassifier is required");
        this.hashtagClassifier = Objects.requireNonNull(hashtagClassifier, "hashtagClassifier is required");
        this.gateway = gateway;
    }

    public static ItemClassifier withGateway(EnrichmentGateway gateway) {
        return new ItemClassifier(new CategoryClassifier(), new HashtagClassifier(gateway), gateway);
    }

    public NewsItem classify(NewsItem item) {
        CategoryDecision decision = categoryClassifier.classify(item.title(), item.cleanText(), item.url(), item.category());
        Category category = decision.category();
        if (decision.ambiguous() && gateway != null && gateway.enabled(EnrichmentTask.CATEGORY_VERIFY)) {
            String text = TextNormalizer.truncate(item.cleanText(), VERIFY_TEXT_CHARS);
            category = gateway.verifyCategory(item.checksum(), item.title(), text, category).orElse(category);
        }
        return item.withClassification(category, hashtagClassifier.classify(item, category));
    }
}
