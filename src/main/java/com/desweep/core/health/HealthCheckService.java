package com.desweep.core.health;

import com.desweep.core.cache.CacheInfo;
import com.desweep.core.cache.CacheProperties;
import com.desweep.core.loader.BulkMetadataLoader;
import com.desweep.core.platform.PlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PlatformProperties platformProperties;
    private final CacheProperties cacheProperties;
    private final BulkMetadataLoader loader;

    public HealthCheckService(PlatformProperties platformProperties, CacheProperties cacheProperties,
                              BulkMetadataLoader loader) {
        this.platformProperties = platformProperties;
        this.cacheProperties = cacheProperties;
        this.loader = loader;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPlatformConfig());
        results.add(checkCacheDirectory());
        results.add(checkBulkCache());
        return results;
    }

    HealthStatus checkPlatformConfig() {
        if (platformProperties.isConfigured()) {
            return new HealthStatus("platform", HealthStatus.Status.UP,
                    "Credentials configured for account " + platformProperties.getAccountId(),
                    Map.of("authUrl", platformProperties.getAuthUrl()));
        }
        return new HealthStatus("platform", HealthStatus.Status.DOWN,
                "Missing client id, client secret, account id or auth URL", Map.of());
    }

    HealthStatus checkCacheDirectory() {
        Path directory = cacheProperties.directoryPath();
        try {
            Files.createDirectories(directory);
            if (!Files.isWritable(directory)) {
                return new HealthStatus("cache-directory", HealthStatus.Status.DOWN,
                        "Cache directory not writable", Map.of("path", directory.toString()));
            }
            return new HealthStatus("cache-directory", HealthStatus.Status.UP,
                    "Cache directory writable", Map.of("path", directory.toString()));
        } catch (IOException e) {
            log.warn("Cache directory health check failed: {}", e.getMessage());
            return new HealthStatus("cache-directory", HealthStatus.Status.DOWN,
                    "Cannot create cache directory: " + e.getMessage(), Map.of("path", directory.toString()));
        }
    }

    HealthStatus checkBulkCache() {
        CacheInfo info = loader.cacheStatus();
        if (!info.exists()) {
            return new HealthStatus("bulk-cache", HealthStatus.Status.DEGRADED,
                    "No bulk cache; the next analysis fetches live", Map.of());
        }
        var metadata = Map.of("age", info.ageString(), "items", String.valueOf(info.itemCount()));
        if (info.ageMs() > cacheProperties.maxAge().toMillis()) {
            return new HealthStatus("bulk-cache", HealthStatus.Status.DEGRADED,
                    "Bulk cache expired (" + info.ageString() + ")", metadata);
        }
        return new HealthStatus("bulk-cache", HealthStatus.Status.UP,
                "Bulk cache fresh (" + info.ageString() + ")", metadata);
    }
}
