package com.desweep.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A discovered reference from one metadata object to one or more target entities.
 * <p>
 * Identity is {@code (type, id)}. Records are immutable; merging an additional
 * affected entity produces a new instance via {@link #withAffectedEntity}.
 * Records lacking an id are identified by name, then by {@link #origin}.
 *
 * @param type             kind of the referencing object
 * @param id               platform id of the referencing object (may be null when the record lacks one)
 * @param name             display name of the referencing object
 * @param status           platform status text, as reported
 * @param detail           which field or strategy produced the match, e.g. "Source DE"
 * @param rawMetadata      projection of the source record used for classification
 * @param affectedEntities target entities this object references
 * @param origin           position of the source record in its collection, e.g. {@code queries#3}; may be null
 */
public record DependencyRecord(
    DependencyType type,
    String id,
    String name,
    String status,
    String detail,
    JsonNode rawMetadata,
    List<TargetEntity> affectedEntities,
    String origin
) {

    public DependencyRecord {
        affectedEntities = affectedEntities == null ? List.of() : List.copyOf(affectedEntities);
    }

    public DependencyRecord(DependencyType type, String id, String name, String status, String detail,
                            JsonNode rawMetadata, List<TargetEntity> affectedEntities) {
        this(type, id, name, status, detail, rawMetadata, affectedEntities, null);
    }

    /**
     * Deduplication key: the id, else the name, else the origin, else a digest of the raw metadata.
     * Stable for the same source record across entities of one dataset.
     */
    public String key() {
        if (hasId()) {
            return type.name() + ":" + id;
        }
        if (name != null && !name.isBlank()) {
            return type.name() + ":name:" + name;
        }
        if (origin != null) {
            return type.name() + ":at:" + origin;
        }
        String raw = rawMetadata == null ? "" : rawMetadata.toString();
        return type.name() + ":raw:" + Integer.toHexString(raw.hashCode());
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    /**
     * Returns a copy with {@code entity} appended, unless an entity with the same
     * primary key is already listed.
     */
    public DependencyRecord withAffectedEntity(TargetEntity entity) {
        boolean present = affectedEntities.stream()
                .anyMatch(e -> e.primaryKey().equals(entity.primaryKey()));
        if (present) {
            return this;
        }
        var merged = new ArrayList<>(affectedEntities);
        merged.add(entity);
        return new DependencyRecord(type, id, name, status, detail, rawMetadata, merged, origin);
    }

    public DependencyRef toRef() {
        return new DependencyRef(type, id, name);
    }
}
