package com.desweep.core.cache;

import java.nio.file.Path;

/**
 * Thrown when a cache lock could not be acquired within the configured attempts.
 * The cache store treats it as a skipped write, never as a failed operation.
 */
public class CacheLockTimeoutException extends RuntimeException {

    private final Path lockFile;

    public CacheLockTimeoutException(Path lockFile, int attempts) {
        super("Could not acquire cache lock " + lockFile + " after " + attempts + " attempts");
        this.lockFile = lockFile;
    }

    public Path getLockFile() {
        return lockFile;
    }
}
