package com.desweep.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ExclusiveFileLockTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private ExclusiveFileLock lock;
    private Path target;

    @BeforeEach
    void setUp() {
        lock = new ExclusiveFileLock(mapper, Duration.ofSeconds(30), Duration.ofMillis(1), 3,
                Clock.fixed(NOW, ZoneOffset.UTC));
        target = dir.resolve("bulk-data-acct.json");
    }

    @Test
    @DisplayName("lock file exists only while the action runs")
    void heldDuringAction() throws Exception {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);
        boolean seen = lock.withExclusiveLock(target, () -> Files.exists(lockFile));
        assertTrue(seen);
        assertFalse(Files.exists(lockFile));
    }

    @Test
    @DisplayName("lock body records pid, timestamp and hostname")
    void lockBody() throws Exception {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);
        var body = lock.withExclusiveLock(target, () -> mapper.readTree(Files.readAllBytes(lockFile)));
        assertEquals(ProcessHandle.current().pid(), body.path("pid").asLong());
        assertEquals(NOW.toEpochMilli(), body.path("timestamp").asLong());
        assertTrue(body.hasNonNull("hostname"));
    }

    @Test
    @DisplayName("lock is released when the action fails")
    void releasedOnFailure() {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);
        assertThrows(IOException.class, () -> lock.withExclusiveLock(target, () -> {
            throw new IOException("disk full");
        }));
        assertFalse(Files.exists(lockFile));
    }

    @Test
    @DisplayName("a fresh foreign lock times out")
    void freshForeignLockTimesOut() throws Exception {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);
        Files.writeString(lockFile, "{\"pid\":1,\"timestamp\":" + NOW.toEpochMilli() + "}");

        var e = assertThrows(CacheLockTimeoutException.class, () -> lock.withExclusiveLock(target, () -> true));
        assertEquals(lockFile, e.getLockFile());
    }

    @Test
    @DisplayName("release leaves a lock that was taken over by another holder")
    void releaseKeepsForeignLock() throws Exception {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);
        byte[] mine = lock.acquire(lockFile);
        Files.writeString(lockFile, "{\"pid\":2,\"timestamp\":1}");

        lock.release(lockFile, mine);
        assertTrue(Files.exists(lockFile));
    }

    @Test
    @DisplayName("isAbandoned compares the recorded timestamp with staleAfter")
    void abandonment() throws Exception {
        Path lockFile = ExclusiveFileLock.lockFileFor(target);

        Files.writeString(lockFile, "{\"timestamp\":" + NOW.minusSeconds(31).toEpochMilli() + "}");
        assertTrue(lock.isAbandoned(lockFile));

        Files.writeString(lockFile, "{\"timestamp\":" + NOW.minusSeconds(5).toEpochMilli() + "}");
        assertFalse(lock.isAbandoned(lockFile));

        Files.delete(lockFile);
        assertFalse(lock.isAbandoned(lockFile));
    }
}
