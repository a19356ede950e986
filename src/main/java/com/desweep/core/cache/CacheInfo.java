package com.desweep.core.cache;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Descriptive information about a cache file. When {@link #exists()} is false
 * only {@link #filePath()} is meaningful.
 */
public record CacheInfo(
    boolean exists,
    Path filePath,
    String cacheType,
    String accountId,
    long fileSize,
    Instant cachedAt,
    long ageMs,
    String ageString,
    int itemCount
) {

    public static CacheInfo missing(Path filePath) {
        return new CacheInfo(false, filePath, null, null, 0, null, 0, null, 0);
    }

    static String formatAge(long ageMs) {
        long minutes = ageMs / 60_000;
        long hours = minutes / 60;
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m ago";
        }
        return minutes + "m ago";
    }
}
