package com.gt.vocab.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

public record AiCacheEntry(
        String cacheKey,
        String termNormalized,
        String version,
        String provider,
        ObjectNode data,
        Instant createdAt,
        Instant updatedAt) { }
