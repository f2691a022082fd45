package com.newsrelay.collectors.enrich;

import com.newsrelay.core.model.BudgetLedger;
import com.newsrelay.core.model.CacheEntry;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface EnrichmentStore {
    Optional<CacheEntry> cacheEntry(String cacheKey);

    void putCacheEntry(CacheEntry entry);

    int deleteExpiredCacheEntries(Instant now);

    CacheStats cacheStats(Instant now);

    BudgetLedger ledger(LocalDate day);

    BudgetLedger recordUsage(LocalDate day, UnaryOperator<BudgetLedger> update);
}
