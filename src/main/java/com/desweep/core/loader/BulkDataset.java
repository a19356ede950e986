package com.desweep.core.loader;

import com.desweep.core.model.DatasetSummary;
import com.desweep.core.model.MetadataCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable aggregate of the seven metadata collections plus lookup indices.
 * <p>
 * Built once per load and read-only afterwards, so it can be shared between
 * threads without locking. Records must not be mutated after construction.
 */
public final class BulkDataset {

    private static final Logger log = LoggerFactory.getLogger(BulkDataset.class);

    private final Map<MetadataCollection, List<JsonNode>> collections;
    private final Instant loadedAt;

    private final Map<String, JsonNode> workflowsById;
    private final Map<String, JsonNode> filtersById;
    /** Lower-cased activity id to ids of workflows containing it. */
    private final Map<String, Set<String>> workflowIdsByActivity;

    private BulkDataset(Map<MetadataCollection, List<JsonNode>> collections, Instant loadedAt) {
        var copy = new EnumMap<MetadataCollection, List<JsonNode>>(MetadataCollection.class);
        for (MetadataCollection collection : MetadataCollection.values()) {
            List<JsonNode> records = collections.get(collection);
            copy.put(collection, records == null ? List.of() : List.copyOf(records));
        }
        this.collections = Collections.unmodifiableMap(copy);
        this.loadedAt = loadedAt;

        var workflows = new LinkedHashMap<String, JsonNode>();
        var byActivity = new LinkedHashMap<String, Set<String>>();
        for (JsonNode workflow : copy.get(MetadataCollection.WORKFLOWS)) {
            String id = text(workflow, "id");
            if (id == null) continue;
            workflows.put(id, workflow);
            for (String activityId : activityIdsOf(workflow)) {
                byActivity.computeIfAbsent(activityId.toLowerCase(Locale.ROOT), k -> new LinkedHashSet<>()).add(id);
            }
        }
        var filters = new LinkedHashMap<String, JsonNode>();
        for (JsonNode filter : copy.get(MetadataCollection.FILTERS)) {
            String id = filterId(filter);
            if (id != null) filters.put(id, filter);
        }
        this.workflowsById = Collections.unmodifiableMap(workflows);
        this.filtersById = Collections.unmodifiableMap(filters);
        this.workflowIdsByActivity = Collections.unmodifiableMap(byActivity);
    }

    public static BulkDataset of(Map<MetadataCollection, List<JsonNode>> collections, Instant loadedAt) {
        return new BulkDataset(collections, loadedAt);
    }

    public static BulkDataset empty(Instant loadedAt) {
        return new BulkDataset(Map.of(), loadedAt);
    }

    public List<JsonNode> records(MetadataCollection collection) {
        return collections.get(collection);
    }

    public List<JsonNode> workflows() {
        return records(MetadataCollection.WORKFLOWS);
    }

    public List<JsonNode> filters() {
        return records(MetadataCollection.FILTERS);
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Optional<JsonNode> workflowById(String id) {
        return Optional.ofNullable(id == null ? null : workflowsById.get(id));
    }

    public Optional<JsonNode> filterById(String id) {
        return Optional.ofNullable(id == null ? null : filtersById.get(id));
    }

    /**
     * Workflows with {@code activityId} among their nested activities, in load order.
     * Uses the activity index, then falls back to walking {@code steps[].activities[]}
     * of workflows the index did not match.
     */
    public List<JsonNode> findWorkflowsContainingActivity(String activityId) {
        if (activityId == null || activityId.isBlank()) {
            return List.of();
        }
        String needle = activityId.toLowerCase(Locale.ROOT);
        Set<String> indexed = workflowIdsByActivity.getOrDefault(needle, Set.of());

        List<JsonNode> matches = new ArrayList<>();
        for (JsonNode workflow : workflows()) {
            String id = text(workflow, "id");
            if (id != null && indexed.contains(id)) {
                matches.add(workflow);
            } else if (stepsContain(workflow, needle)) {
                matches.add(workflow);
            }
        }
        return matches;
    }

    public DatasetSummary summary() {
        return new DatasetSummary(
                records(MetadataCollection.WORKFLOWS).size(),
                records(MetadataCollection.FILTERS).size(),
                records(MetadataCollection.QUERIES).size(),
                records(MetadataCollection.IMPORTS).size(),
                records(MetadataCollection.TRIGGERED_MESSAGES).size(),
                records(MetadataCollection.JOURNEYS).size(),
                records(MetadataCollection.DATA_EXTRACTS).size(),
                loadedAt);
    }

    /** Item counts keyed by persisted field name, as stored in cache metadata. */
    public Map<String, Object> itemCounts() {
        var counts = new LinkedHashMap<String, Object>();
        for (MetadataCollection collection : MetadataCollection.values()) {
            counts.put(collection.jsonField(), records(collection).size());
        }
        return counts;
    }

    /**
     * Serialises the collections for the cache. Indices are not persisted; they are
     * rebuilt by {@link #fromCacheJson}.
     */
    public ObjectNode toCacheJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        for (MetadataCollection collection : MetadataCollection.values()) {
            ArrayNode array = root.putArray(collection.jsonField());
            records(collection).forEach(array::add);
        }
        root.put("loadedAt", loadedAt.toString());
        return root;
    }

    /**
     * Rebuilds a dataset from its cached form. Missing collections become empty.
     */
    public static BulkDataset fromCacheJson(JsonNode data, Instant fallbackLoadedAt) {
        var collections = new EnumMap<MetadataCollection, List<JsonNode>>(MetadataCollection.class);
        for (MetadataCollection collection : MetadataCollection.values()) {
            List<JsonNode> records = new ArrayList<>();
            JsonNode array = data.path(collection.jsonField());
            if (array.isArray()) {
                array.forEach(records::add);
            }
            collections.put(collection, records);
        }
        Instant loadedAt = fallbackLoadedAt;
        String stored = text(data, "loadedAt");
        if (stored != null) {
            try {
                loadedAt = Instant.parse(stored);
            } catch (DateTimeParseException e) {
                log.debug("Cached loadedAt '{}' unreadable, using {}", stored, fallbackLoadedAt);
            }
        }
        return new BulkDataset(collections, loadedAt);
    }

    /** Id of a standalone filter: {@code filterActivityId}, else {@code id}. */
    public static String filterId(JsonNode filter) {
        String id = text(filter, "filterActivityId");
        return id != null ? id : text(filter, "id");
    }

    /**
     * Activity ids nested in a workflow. Uses its precomputed {@code activityIds} when
     * present, otherwise extracts {@code activityObjectId} and {@code id} from every step activity.
     */
    static List<String> activityIdsOf(JsonNode workflow) {
        List<String> ids = new ArrayList<>();
        JsonNode precomputed = workflow.path("activityIds");
        if (precomputed.isArray() && !precomputed.isEmpty()) {
            precomputed.forEach(n -> {
                if (n.isTextual() && !n.asText().isEmpty()) ids.add(n.asText());
            });
            return ids;
        }
        return extractActivityIds(workflow.path("steps"));
    }

    static List<String> extractActivityIds(JsonNode steps) {
        List<String> ids = new ArrayList<>();
        if (!steps.isArray()) return ids;
        for (JsonNode step : steps) {
            JsonNode activities = step.path("activities");
            if (!activities.isArray()) continue;
            for (JsonNode activity : activities) {
                String objectId = text(activity, "activityObjectId");
                if (objectId != null) ids.add(objectId);
                String id = text(activity, "id");
                if (id != null) ids.add(id);
            }
        }
        return ids;
    }

    private static boolean stepsContain(JsonNode workflow, String needleLower) {
        for (String id : extractActivityIds(workflow.path("steps"))) {
            if (id.toLowerCase(Locale.ROOT).equals(needleLower)) {
                return true;
            }
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
