package com.desweep.core.health;

import com.desweep.core.cache.CacheInfo;
import com.desweep.core.cache.CacheProperties;
import com.desweep.core.loader.BulkMetadataLoader;
import com.desweep.core.platform.PlatformProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private PlatformProperties platform;
    private CacheProperties cache;
    private BulkMetadataLoader loader;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        platform = new PlatformProperties();
        cache = new CacheProperties();
        cache.setDirectory(tempDir.resolve("cache").toString());
        loader = mock(BulkMetadataLoader.class);
        when(loader.cacheStatus()).thenReturn(CacheInfo.missing(tempDir.resolve("cache/bulk-data-default.json")));
        service = new HealthCheckService(platform, cache, loader);
    }

    private static CacheInfo cachedAgo(Duration age) {
        return new CacheInfo(true, Path.of("bulk-data-acct.json"), "bulk-data", "acct", 100,
                Instant.now().minus(age), age.toMillis(), "some time ago", 42);
    }

    @Test
    @DisplayName("checkAll returns platform, cache-directory and bulk-cache components")
    void checkAllReturnsAllComponents() {
        List<HealthStatus> results = service.checkAll();

        var components = results.stream().map(HealthStatus::component).toList();
        assertEquals(List.of("platform", "cache-directory", "bulk-cache"), components);
    }

    @Test
    @DisplayName("Missing credentials -> platform DOWN")
    void platformNotConfigured() {
        assertEquals(HealthStatus.Status.DOWN, service.checkPlatformConfig().status());
    }

    @Test
    @DisplayName("Credentials present -> platform UP")
    void platformConfigured() {
        platform.setClientId("id");
        platform.setClientSecret("secret");
        platform.setAccountId("5000");
        platform.setAuthUrl("https://auth.example");

        var status = service.checkPlatformConfig();
        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(status.detail().contains("5000"));
    }

    @Test
    @DisplayName("Cache directory is created when missing -> UP")
    void cacheDirectoryCreated() {
        assertEquals(HealthStatus.Status.UP, service.checkCacheDirectory().status());
        assertTrue(Files.isDirectory(tempDir.resolve("cache")));
    }

    @Test
    @DisplayName("Cache directory path is a file -> DOWN")
    void cacheDirectoryBlocked() throws Exception {
        Path file = Files.writeString(tempDir.resolve("blocker"), "x");
        cache.setDirectory(file.toString());

        assertEquals(HealthStatus.Status.DOWN, service.checkCacheDirectory().status());
    }

    @Test
    @DisplayName("No bulk cache -> DEGRADED")
    void noBulkCache() {
        assertEquals(HealthStatus.Status.DEGRADED, service.checkBulkCache().status());
    }

    @Test
    @DisplayName("Fresh bulk cache -> UP with item count")
    void freshBulkCache() {
        when(loader.cacheStatus()).thenReturn(cachedAgo(Duration.ofHours(2)));

        var status = service.checkBulkCache();
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("42", status.metadata().get("items"));
    }

    @Test
    @DisplayName("Expired bulk cache -> DEGRADED")
    void expiredBulkCache() {
        when(loader.cacheStatus()).thenReturn(cachedAgo(Duration.ofHours(30)));
        assertEquals(HealthStatus.Status.DEGRADED, service.checkBulkCache().status());
    }
}
