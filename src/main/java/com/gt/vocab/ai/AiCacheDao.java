package com.gt.vocab.ai;

import com.gt.vocab.model.AiCacheEntry;

import java.util.Optional;

public interface AiCacheDao {

    Optional<AiCacheEntry> loadCacheEntry(String cacheKey);

    // Inserts or replaces the entry for its key; createdAt is only written on first insert
    AiCacheEntry upsertCacheEntry(AiCacheEntry entry);
}
