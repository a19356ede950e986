package com.desweep.core.loader;

import com.desweep.core.cache.CacheInfo;
import com.desweep.core.cache.CacheStore;
import com.desweep.core.events.AuditEvent;
import com.desweep.core.events.EventBus;
import com.desweep.core.metrics.DesweepMetrics;
import com.desweep.core.model.MetadataCollection;
import com.desweep.core.platform.MetadataSourceClient;
import com.desweep.core.platform.PlatformProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads the seven metadata collections once and hands out a shared {@link BulkDataset}.
 *
 * <p>Lookup order: the caller's {@link MetadataCacheContext}, then the persisted
 * {@value #BULK_CACHE_TYPE} cache entry within its TTL, then a live fetch.
 * A live fetch runs the seven list calls concurrently; a collection that fails is
 * logged and degrades to empty. Only a failed connectivity check aborts the load.
 */
@Service
public class BulkMetadataLoader {

    private static final Logger log = LoggerFactory.getLogger(BulkMetadataLoader.class);

    public static final String BULK_CACHE_TYPE = "bulk-data";

    private final MetadataSourceClient sourceClient;
    private final CacheStore cacheStore;
    private final PlatformProperties platformProperties;
    private final LoaderProperties loaderProperties;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;
    private final DesweepMetrics metrics;
    private final Clock clock;

    public BulkMetadataLoader(MetadataSourceClient sourceClient, CacheStore cacheStore,
                              PlatformProperties platformProperties, LoaderProperties loaderProperties,
                              ObjectMapper objectMapper, EventBus eventBus, DesweepMetrics metrics, Clock clock) {
        this.sourceClient = sourceClient;
        this.cacheStore = cacheStore;
        this.platformProperties = platformProperties;
        this.loaderProperties = loaderProperties;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Returns the dataset for this run, loading it if needed.
     *
     * @throws com.desweep.core.platform.PlatformConnectionException if a live fetch
     *         is needed and the platform cannot be reached
     */
    public BulkDataset load(LoadOptions options, MetadataCacheContext context) {
        return load(options, context, null);
    }

    public BulkDataset load(LoadOptions options, MetadataCacheContext context, String runId) {
        long start = System.currentTimeMillis();
        var progress = new Progress(options.onProgress(), runId);

        if (!options.forceRefresh()) {
            Optional<BulkDataset> inMemory = context.current();
            if (inMemory.isPresent()) {
                log.debug("Using in-memory bulk dataset");
                progress.report("cached", 1, 1, "Using in-memory cached data");
                metrics.recordLoad("memory", System.currentTimeMillis() - start);
                return inMemory.get();
            }

            Optional<BulkDataset> fromDisk = readCache();
            if (fromDisk.isPresent()) {
                String age = cacheStatus().ageString();
                log.info("Using cached bulk data ({})", age);
                progress.report("cached", 1, 1, "Using cached data (" + age + ")");
                context.set(fromDisk.get());
                metrics.recordLoad("disk", System.currentTimeMillis() - start);
                publishCompleted(runId, "disk", fromDisk.get());
                return fromDisk.get();
            }
        }

        BulkDataset dataset = fetchLive(options, progress);
        context.set(dataset);

        boolean cached = cacheStore.write(BULK_CACHE_TYPE, platformProperties.cacheAccountKey(),
                dataset.toCacheJson(objectMapper), Map.of("itemCounts", dataset.itemCounts()));
        metrics.recordCacheWrite(cached);
        if (!cached) {
            log.warn("Bulk data could not be cached; continuing with in-memory data");
        }

        var summary = dataset.summary();
        log.info("Bulk data loaded: {} workflows, {} filters, {} queries, {} imports, {} triggered messages, "
                        + "{} journeys, {} data extracts",
                summary.workflows(), summary.filters(), summary.queries(), summary.imports(),
                summary.triggeredMessages(), summary.journeys(), summary.dataExtracts());
        metrics.recordLoad("live", System.currentTimeMillis() - start);
        publishCompleted(runId, "live", dataset);
        return dataset;
    }

    /**
     * Drops the in-memory dataset and the persisted bulk entry.
     */
    public boolean invalidate(MetadataCacheContext context) {
        context.invalidate();
        return cacheStore.clear(BULK_CACHE_TYPE, platformProperties.cacheAccountKey());
    }

    public CacheInfo cacheStatus() {
        return cacheStore.info(BULK_CACHE_TYPE, platformProperties.cacheAccountKey());
    }

    private Optional<BulkDataset> readCache() {
        return cacheStore.read(BULK_CACHE_TYPE, platformProperties.cacheAccountKey())
                .map(entry -> BulkDataset.fromCacheJson(entry.data(), entry.cachedAt()));
    }

    private BulkDataset fetchLive(LoadOptions options, Progress progress) {
        sourceClient.verifyConnection();

        var collections = new EnumMap<MetadataCollection, List<JsonNode>>(MetadataCollection.class);
        ExecutorService executor = Executors.newFixedThreadPool(MetadataCollection.values().length,
                namedThreads("desweep-load"));
        try {
            var futures = new EnumMap<MetadataCollection, CompletableFuture<List<JsonNode>>>(MetadataCollection.class);
            for (MetadataCollection collection : MetadataCollection.values()) {
                futures.put(collection, CompletableFuture.supplyAsync(() -> fetchCollection(collection, progress), executor));
            }
            futures.forEach((collection, future) -> collections.put(collection, future.join()));
        } finally {
            executor.shutdownNow();
        }

        if (options.includeWorkflowDetail()) {
            collections.put(MetadataCollection.WORKFLOWS,
                    hydrateWorkflows(collections.get(MetadataCollection.WORKFLOWS), progress));
        }
        if (options.includeQueryText()) {
            collections.put(MetadataCollection.QUERIES,
                    hydrateQueryText(collections.get(MetadataCollection.QUERIES), progress));
        }
        return BulkDataset.of(collections, clock.instant());
    }

    private List<JsonNode> fetchCollection(MetadataCollection collection, Progress progress) {
        progress.report(collection.stage(), 0, 1, "Loading " + collection.stage() + "...");
        try {
            List<JsonNode> records = sourceClient.list(collection);
            metrics.recordCollectionSize(collection.stage(), records.size());
            progress.report(collection.stage(), 1, 1, "Loaded " + records.size() + " " + collection.stage());
            return records;
        } catch (RuntimeException e) {
            log.warn("Failed to load {}: {}", collection.stage(), e.getMessage());
            metrics.recordSourceFailure(collection.stage());
            progress.report(collection.stage(), 1, 1, "Failed to load " + collection.stage());
            return List.of();
        }
    }

    /**
     * Replaces each listed workflow with its normalised full definition, in batches.
     * A workflow whose detail cannot be fetched keeps its list record with a
     * {@code detailsError} field.
     */
    List<JsonNode> hydrateWorkflows(List<JsonNode> listed, Progress progress) {
        if (listed.isEmpty()) {
            return listed;
        }
        int batchSize = Math.max(1, loaderProperties.getWorkflowDetailBatchSize());
        int total = listed.size();
        List<JsonNode> hydrated = new ArrayList<>(total);
        progress.report("workflow-details", 0, total, "Loading workflow details...");

        ExecutorService executor = Executors.newFixedThreadPool(batchSize, namedThreads("desweep-workflow"));
        try {
            for (int i = 0; i < total; i += batchSize) {
                List<JsonNode> batch = listed.subList(i, Math.min(i + batchSize, total));
                List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
                for (JsonNode workflow : batch) {
                    futures.add(CompletableFuture.supplyAsync(() -> hydrateWorkflow(workflow), executor));
                }
                for (CompletableFuture<JsonNode> future : futures) {
                    hydrated.add(future.join());
                }
                int done = Math.min(i + batchSize, total);
                progress.report("workflow-details", done, total,
                        "Loaded %d/%d workflow details".formatted(done, total));
            }
        } finally {
            executor.shutdownNow();
        }
        return hydrated;
    }

    private JsonNode hydrateWorkflow(JsonNode listed) {
        String id = listed.path("id").asText(null);
        if (id == null || id.isEmpty()) {
            return withDetailsError(listed, "workflow has no id");
        }
        try {
            return normaliseWorkflow(sourceClient.getWorkflowDetail(id));
        } catch (RuntimeException e) {
            log.debug("Failed to get details for workflow {}: {}", id, e.getMessage());
            return withDetailsError(listed, e.getMessage());
        }
    }

    ObjectNode normaliseWorkflow(JsonNode detail) {
        ObjectNode workflow = objectMapper.createObjectNode();
        for (String field : List.of("id", "name", "key", "description", "status", "statusId", "categoryId",
                "createdDate", "modifiedDate", "lastRunTime", "lastRunInstanceId")) {
            JsonNode value = detail.get(field);
            if (value != null && !value.isNull()) {
                workflow.set(field, value);
            }
        }
        JsonNode steps = detail.path("steps");
        workflow.set("steps", steps.isArray() ? steps : objectMapper.createArrayNode());
        ArrayNode activityIds = workflow.putArray("activityIds");
        BulkDataset.extractActivityIds(steps).forEach(activityIds::add);
        return workflow;
    }

    private ObjectNode withDetailsError(JsonNode listed, String error) {
        ObjectNode workflow = listed.isObject() ? ((ObjectNode) listed).deepCopy() : objectMapper.createObjectNode();
        if (!workflow.path("steps").isArray()) {
            workflow.putArray("steps");
        }
        ArrayNode activityIds = workflow.putArray("activityIds");
        BulkDataset.extractActivityIds(workflow.path("steps")).forEach(activityIds::add);
        workflow.put("detailsError", error == null ? "unknown error" : error);
        return workflow;
    }

    /**
     * Adds {@code queryText} to queries that lack it. Ids are processed in batches,
     * each with a bounded number of concurrent fetches.
     */
    List<JsonNode> hydrateQueryText(List<JsonNode> queries, Progress progress) {
        List<String> missing = new ArrayList<>();
        for (JsonNode query : queries) {
            String id = queryId(query);
            if (id != null && !hasQueryText(query)) {
                missing.add(id);
            }
        }
        if (missing.isEmpty()) {
            return queries;
        }

        int batchSize = Math.max(1, loaderProperties.getQueryTextBatchSize());
        int concurrency = Math.max(1, loaderProperties.getQueryTextConcurrency());
        Map<String, String> texts = new LinkedHashMap<>();
        AtomicInteger failures = new AtomicInteger();
        progress.report("query-text", 0, missing.size(), "Loading query text...");

        ExecutorService executor = Executors.newFixedThreadPool(concurrency, namedThreads("desweep-query"));
        try {
            for (int i = 0; i < missing.size(); i += batchSize) {
                List<String> batch = missing.subList(i, Math.min(i + batchSize, missing.size()));
                Map<String, CompletableFuture<Optional<String>>> futures = new LinkedHashMap<>();
                for (String id : batch) {
                    futures.put(id, CompletableFuture.supplyAsync(() -> fetchQueryText(id, failures), executor));
                }
                futures.forEach((id, future) -> future.join().ifPresent(text -> texts.put(id, text)));
                int done = Math.min(i + batchSize, missing.size());
                progress.report("query-text", done, missing.size(),
                        "Loaded %d/%d query texts".formatted(done, missing.size()));
            }
        } finally {
            executor.shutdownNow();
        }
        if (failures.get() > 0) {
            log.warn("Query text unavailable for {} of {} queries", failures.get(), missing.size());
        }

        List<JsonNode> result = new ArrayList<>(queries.size());
        for (JsonNode query : queries) {
            String text = texts.get(queryId(query));
            if (text != null && query.isObject()) {
                ObjectNode copy = ((ObjectNode) query).deepCopy();
                copy.put("queryText", text);
                result.add(copy);
            } else {
                result.add(query);
            }
        }
        log.info("Loaded query text for {}/{} queries", texts.size(), missing.size());
        return result;
    }

    private Optional<String> fetchQueryText(String id, AtomicInteger failures) {
        try {
            return sourceClient.getQueryText(id);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.debug("Failed to load query text for {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    static String queryId(JsonNode query) {
        for (String field : List.of("queryDefinitionId", "ObjectID", "id")) {
            String value = query.path(field).asText(null);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static boolean hasQueryText(JsonNode query) {
        return !query.path("queryText").asText("").isEmpty() || !query.path("QueryText").asText("").isEmpty();
    }

    private void publishCompleted(String runId, String source, BulkDataset dataset) {
        eventBus.publish(AuditEvent.of(AuditEvent.LOAD_COMPLETED, runId, null,
                Map.of("source", source, "items", dataset.summary().total())));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Fans progress out to the caller's listener and the event bus. */
    final class Progress {
        private final LoadProgressListener listener;
        private final String runId;

        Progress(LoadProgressListener listener, String runId) {
            this.listener = listener;
            this.runId = runId;
        }

        void report(String stage, int current, int total, String message) {
            log.debug("[{}] {}/{}: {}", stage, current, total, message);
            try {
                listener.onProgress(stage, current, total, message);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at stage {}: {}", stage, e.getMessage());
            }
            eventBus.publish(AuditEvent.of(AuditEvent.LOAD_PROGRESS, runId, null, Map.of(
                    "stage", stage, "current", current, "total", total, "message", message)));
        }
    }
}
