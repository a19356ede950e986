package com.desweep.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * One persisted cache blob. Superseded, never mutated, by the next write
 * to the same {@code (cacheType, accountId)}.
 */
public record CacheEntry(
    String cacheType,
    String accountId,
    JsonNode data,
    Instant cachedAt,
    Map<String, Object> extraMetadata
) {}
