package com.desweep.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * TTL'd, process-safe JSON persistence, one file per {@code (cacheType, accountId)}.
 *
 * <p>File layout:
 * <pre>
 * { "metadata": { "cachedAt": ISO-8601, "accountId": ..., "cacheType": ..., ...extra },
 *   "data": ... }
 * </pre>
 *
 * <p>Writers hold an {@link ExclusiveFileLock}, write to a temporary sibling and
 * atomically rename it over the target, so readers never observe a partial file.
 * Readers take no lock. Any parse failure or missing {@code cachedAt} is a miss.
 * Caching is best-effort: {@link #write} returns {@code false} instead of throwing.
 */
@Component
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private static final Set<String> RESERVED_METADATA = Set.of("cachedAt", "accountId", "cacheType");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final Duration defaultMaxAge;
    private final ExclusiveFileLock lock;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public CacheStore(CacheProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Clock.systemUTC());
    }

    CacheStore(CacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties.directoryPath(), properties.maxAge(),
                new ExclusiveFileLock(objectMapper,
                        Duration.ofMillis(properties.getLockTimeoutMs()),
                        Duration.ofMillis(properties.getLockRetryDelayMs()),
                        properties.getLockMaxRetries(), clock),
                objectMapper, clock);
    }

    CacheStore(Path directory, Duration defaultMaxAge, ExclusiveFileLock lock,
               ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.defaultMaxAge = defaultMaxAge;
        this.lock = lock;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path cacheFilePath(String cacheType, String accountId) {
        Objects.requireNonNull(cacheType, "cacheType");
        Objects.requireNonNull(accountId, "accountId");
        return directory.resolve(cacheType + "-" + accountId + ".json");
    }

    public Optional<CacheEntry> read(String cacheType, String accountId) {
        return read(cacheType, accountId, defaultMaxAge, false);
    }

    /**
     * Reads the current entry.
     *
     * @param maxAge       entries older than this are treated as absent
     * @param ignoreExpiry return the entry regardless of age
     * @return the entry, or empty on miss, expiry, or unreadable file
     */
    public Optional<CacheEntry> read(String cacheType, String accountId, Duration maxAge, boolean ignoreExpiry) {
        Path file = cacheFilePath(cacheType, accountId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            Optional<Instant> cachedAt = cachedAt(root);
            if (cachedAt.isEmpty()) {
                log.debug("Cache file {} has no cachedAt metadata, ignoring", file);
                return Optional.empty();
            }
            if (!ignoreExpiry && isExpired(cachedAt.get(), maxAge)) {
                log.debug("Cache file {} expired (cachedAt={})", file, cachedAt.get());
                return Optional.empty();
            }
            return Optional.of(new CacheEntry(cacheType, accountId, root.get("data"),
                    cachedAt.get(), extraMetadata(root.get("metadata"))));
        } catch (IOException | RuntimeException e) {
            log.debug("Unreadable cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces the entry for {@code (cacheType, accountId)}.
     *
     * @return true if the new entry is on disk, false if the lock could not be
     *         acquired or the write failed
     */
    public boolean write(String cacheType, String accountId, JsonNode data, Map<String, Object> extraMetadata) {
        Path file = cacheFilePath(cacheType, accountId);
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("cachedAt", clock.instant().toString());
        metadata.put("accountId", accountId);
        metadata.put("cacheType", cacheType);
        if (extraMetadata != null) {
            extraMetadata.forEach((key, value) -> {
                if (!RESERVED_METADATA.contains(key)) {
                    metadata.set(key, objectMapper.valueToTree(value));
                }
            });
        }
        root.set("data", data);

        try {
            Files.createDirectories(directory);
            return lock.withExclusiveLock(file, () -> {
                writeAtomically(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
                return true;
            });
        } catch (CacheLockTimeoutException e) {
            log.warn("Skipping cache write for {}: {}", file.getFileName(), e.getMessage());
            return false;
        } catch (IOException e) {
            log.warn("Failed to write cache file {}: {}", file, e.getMessage());
            return false;
        }
    }

    public boolean clear(String cacheType, String accountId) {
        Path file = cacheFilePath(cacheType, accountId);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("Cleared cache {}", file.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to clear cache file {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Removes every cache file belonging to {@code accountId}.
     *
     * @return number of files removed
     */
    public int clearAll(String accountId) {
        String suffix = "-" + accountId + ".json";
        int cleared = 0;
        for (Path file : cacheFiles()) {
            if (file.getFileName().toString().endsWith(suffix)) {
                try {
                    if (Files.deleteIfExists(file)) {
                        cleared++;
                    }
                } catch (IOException e) {
                    log.warn("Failed to clear cache file {}: {}", file, e.getMessage());
                }
            }
        }
        log.info("Cleared {} cache file(s) for account {}", cleared, accountId);
        return cleared;
    }

    public CacheInfo info(String cacheType, String accountId) {
        return describe(cacheFilePath(cacheType, accountId));
    }

    public List<CacheInfo> listAll() {
        var infos = new ArrayList<CacheInfo>();
        for (Path file : cacheFiles()) {
            CacheInfo info = describe(file);
            if (info.exists()) {
                infos.add(info);
            }
        }
        return infos;
    }

    private CacheInfo describe(Path file) {
        if (!Files.exists(file)) {
            return CacheInfo.missing(file);
        }
        try {
            long size = Files.size(file);
            JsonNode root = objectMapper.readTree(file.toFile());
            Optional<Instant> cachedAt = cachedAt(root);
            if (cachedAt.isEmpty()) {
                return CacheInfo.missing(file);
            }
            long ageMs = Duration.between(cachedAt.get(), clock.instant()).toMillis();
            JsonNode metadata = root.get("metadata");
            return new CacheInfo(true, file,
                    metadata.path("cacheType").asText(null),
                    metadata.path("accountId").asText(null),
                    size, cachedAt.get(), ageMs, CacheInfo.formatAge(ageMs),
                    countItems(metadata.get("itemCounts"), root.get("data")));
        } catch (IOException | RuntimeException e) {
            log.debug("Cannot describe cache file {}: {}", file, e.getMessage());
            return CacheInfo.missing(file);
        }
    }

    private List<Path> cacheFiles() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list cache directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private void writeAtomically(Path file, byte[] bytes) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote cache file {} ({} bytes)", file, bytes.length);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private boolean isExpired(Instant cachedAt, Duration maxAge) {
        return Duration.between(cachedAt, clock.instant()).compareTo(maxAge) > 0;
    }

    private static Optional<Instant> cachedAt(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        JsonNode value = root.path("metadata").get("cachedAt");
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(Instant.parse(value.asText()));
    }

    private Map<String, Object> extraMetadata(JsonNode metadata) {
        Map<String, Object> all = objectMapper.convertValue(metadata, MAP_TYPE);
        all.keySet().removeAll(RESERVED_METADATA);
        return all;
    }

    /** Sum of recorded {@code itemCounts} when present, else the size of {@code data}. */
    private static int countItems(JsonNode itemCounts, JsonNode data) {
        if (itemCounts != null && itemCounts.isObject()) {
            int total = 0;
            for (JsonNode count : itemCounts) {
                total += count.asInt();
            }
            return total;
        }
        if (data == null || data.isNull()) {
            return 0;
        }
        if (data.isArray() || data.isObject()) {
            return data.size();
        }
        return 1;
    }
}
