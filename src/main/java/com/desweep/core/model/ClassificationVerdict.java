package com.desweep.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of classifying one {@link DependencyRecord}.
 *
 * @param classification one of the three classifications
 * @param reasonCode     machine-readable reason
 * @param reason         human-readable reason, may carry specifics such as blocking workflow names
 * @param metadata       supporting facts in insertion order
 * @param canDelete      true only for {@link Classification#SAFE_TO_DELETE}
 */
public record ClassificationVerdict(
    Classification classification,
    ReasonCode reasonCode,
    String reason,
    Map<String, Object> metadata,
    boolean canDelete
) {

    public ClassificationVerdict {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ClassificationVerdict safe(ReasonCode reason, Map<String, Object> metadata) {
        return new ClassificationVerdict(Classification.SAFE_TO_DELETE, reason, reason.description(), metadata, true);
    }

    public static ClassificationVerdict review(ReasonCode reason, Map<String, Object> metadata) {
        return review(reason, reason.description(), metadata);
    }

    public static ClassificationVerdict review(ReasonCode reason, String text, Map<String, Object> metadata) {
        return new ClassificationVerdict(Classification.REQUIRES_REVIEW, reason, text, metadata, false);
    }

    public static ClassificationVerdict unknown(Map<String, Object> metadata) {
        return new ClassificationVerdict(Classification.UNKNOWN, ReasonCode.INSUFFICIENT_METADATA,
                ReasonCode.INSUFFICIENT_METADATA.description(), metadata, false);
    }
}
