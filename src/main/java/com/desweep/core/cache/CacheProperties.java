package com.desweep.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "desweep.cache")
public class CacheProperties {

    private String directory = "cache";
    private long maxAgeHours = 24;
    private long lockTimeoutMs = 30_000;
    private long lockRetryDelayMs = 100;
    private int lockMaxRetries = 50;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public long getMaxAgeHours() {
        return maxAgeHours;
    }

    public void setMaxAgeHours(long maxAgeHours) {
        this.maxAgeHours = maxAgeHours;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public long getLockRetryDelayMs() {
        return lockRetryDelayMs;
    }

    public void setLockRetryDelayMs(long lockRetryDelayMs) {
        this.lockRetryDelayMs = lockRetryDelayMs;
    }

    public int getLockMaxRetries() {
        return lockMaxRetries;
    }

    public void setLockMaxRetries(int lockMaxRetries) {
        this.lockMaxRetries = lockMaxRetries;
    }

    public Path directoryPath() {
        return Path.of(directory);
    }

    public Duration maxAge() {
        return Duration.ofHours(maxAgeHours);
    }
}
