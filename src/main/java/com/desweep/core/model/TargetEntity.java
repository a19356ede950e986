package com.desweep.core.model;

import java.io.Serializable;

/**
 * A data extension being tested for safety-to-delete.
 * <p>
 * Only {@link #primaryKey} is required. {@link #alternateName} enables name-based
 * matching inside query text, and {@link #opaqueId} enables exact matching against
 * filter source/destination object ids.
 */
public record TargetEntity(
    String primaryKey,
    String alternateName,
    String opaqueId
) implements Serializable {

    public TargetEntity {
        if (primaryKey == null || primaryKey.isBlank()) {
            throw new IllegalArgumentException("primaryKey must not be blank");
        }
    }

    public static TargetEntity ofKey(String primaryKey) {
        return new TargetEntity(primaryKey, null, null);
    }

    /**
     * Parses the CLI form {@code key[:name[:objectId]]}.
     */
    public static TargetEntity parse(String spec) {
        String[] parts = spec.split(":", 3);
        String name = parts.length > 1 && !parts[1].isBlank() ? parts[1] : null;
        String objectId = parts.length > 2 && !parts[2].isBlank() ? parts[2] : null;
        return new TargetEntity(parts[0].trim(), name, objectId);
    }

    public String displayName() {
        return alternateName != null && !alternateName.isBlank() ? alternateName : primaryKey;
    }
}
