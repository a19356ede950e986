package com.desweep.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

/**
 * Cross-process mutual exclusion built on a sibling {@code <target>.lock} file.
 *
 * <p>The lock file is created with {@code CREATE_NEW}, which fails if another
 * process already holds it. A held lock older than {@code staleAfter} is treated
 * as abandoned and removed. Otherwise acquisition retries at a fixed interval and
 * gives up with {@link CacheLockTimeoutException} after {@code maxRetries}.
 *
 * <p>The lock body is {@code {"pid", "timestamp", "hostname"}}. Release only deletes
 * a lock file whose body is still the one this holder wrote, so a lock taken over
 * by another process after forced removal is left alone.
 */
public class ExclusiveFileLock {

    private static final Logger log = LoggerFactory.getLogger(ExclusiveFileLock.class);

    private final ObjectMapper objectMapper;
    private final Duration staleAfter;
    private final Duration retryDelay;
    private final int maxRetries;
    private final Clock clock;

    public ExclusiveFileLock(ObjectMapper objectMapper, Duration staleAfter, Duration retryDelay,
                             int maxRetries, Clock clock) {
        this.objectMapper = objectMapper;
        this.staleAfter = staleAfter;
        this.retryDelay = retryDelay;
        this.maxRetries = maxRetries;
        this.clock = clock;
    }

    /**
     * Work executed while the lock is held.
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    public static Path lockFileFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".lock");
    }

    /**
     * Runs {@code action} while holding the lock for {@code target}. The lock is
     * released on every exit path.
     *
     * @throws CacheLockTimeoutException if the lock could not be acquired
     * @throws IOException               if the action fails
     */
    public <T> T withExclusiveLock(Path target, LockedAction<T> action) throws IOException {
        Path lockFile = lockFileFor(target);
        byte[] body = acquire(lockFile);
        try {
            return action.run();
        } finally {
            release(lockFile, body);
        }
    }

    byte[] acquire(Path lockFile) throws IOException {
        if (lockFile.getParent() != null) {
            Files.createDirectories(lockFile.getParent());
        }
        int attempts = 0;
        while (attempts <= maxRetries) {
            byte[] body = lockBody();
            try {
                Files.write(lockFile, body, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debug("Acquired cache lock {}", lockFile);
                return body;
            } catch (FileAlreadyExistsException e) {
                if (isAbandoned(lockFile)) {
                    log.warn("Removing abandoned cache lock {} (older than {}ms)", lockFile, staleAfter.toMillis());
                    Files.deleteIfExists(lockFile);
                    continue;
                }
            }
            attempts++;
            pause(lockFile);
        }
        throw new CacheLockTimeoutException(lockFile, attempts);
    }

    void release(Path lockFile, byte[] body) {
        try {
            byte[] current = Files.readAllBytes(lockFile);
            if (Arrays.equals(current, body)) {
                Files.deleteIfExists(lockFile);
                log.debug("Released cache lock {}", lockFile);
            } else {
                log.warn("Cache lock {} was taken over by another holder; leaving it in place", lockFile);
            }
        } catch (NoSuchFileException e) {
            log.warn("Cache lock {} disappeared before release", lockFile);
        } catch (IOException e) {
            log.warn("Failed to release cache lock {}: {}", lockFile, e.getMessage());
        }
    }

    /**
     * A lock is abandoned when its recorded timestamp (or, if the body is not
     * readable yet, its modification time) is older than {@code staleAfter}.
     */
    boolean isAbandoned(Path lockFile) {
        long lockedAt;
        try {
            JsonNode json = objectMapper.readTree(Files.readAllBytes(lockFile));
            if (json != null && json.hasNonNull("timestamp")) {
                lockedAt = json.get("timestamp").asLong();
            } else {
                lockedAt = Files.getLastModifiedTime(lockFile).toMillis();
            }
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            try {
                lockedAt = Files.getLastModifiedTime(lockFile).toMillis();
            } catch (IOException statFailure) {
                log.debug("Cannot inspect cache lock {}: {}", lockFile, statFailure.getMessage());
                return false;
            }
        }
        return clock.millis() - lockedAt > staleAfter.toMillis();
    }

    private byte[] lockBody() throws IOException {
        var node = objectMapper.createObjectNode();
        node.put("pid", ProcessHandle.current().pid());
        node.put("timestamp", clock.millis());
        node.put("hostname", hostname());
        return objectMapper.writeValueAsBytes(node);
    }

    private void pause(Path lockFile) {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheLockTimeoutException(lockFile, maxRetries);
        }
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
