package com.desweep.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while loading metadata or analysing entities, used for CLI progress output.
 *
 * @param eventType event type (e.g. "load.progress", "analysis.completed")
 * @param runId     the analysis run this event belongs to (nullable for standalone loads)
 * @param entityKey the entity this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AuditEvent(
    String eventType,
    String runId,
    String entityKey,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String LOAD_PROGRESS = "load.progress";
    public static final String LOAD_COMPLETED = "load.completed";
    public static final String ANALYSIS_PROGRESS = "analysis.progress";
    public static final String ANALYSIS_COMPLETED = "analysis.completed";

    public static AuditEvent of(String eventType, String runId, String entityKey, Map<String, Object> payload) {
        return new AuditEvent(eventType, runId, entityKey, payload, Instant.now());
    }
}
