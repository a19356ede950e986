package com.desweep.core.model;

/**
 * Verdict counts for one {@link DependencyType}.
 */
public record TypeSummary(int total, int safeToDelete, int requiresReview, int unknown) {

    public static final TypeSummary EMPTY = new TypeSummary(0, 0, 0, 0);

    public TypeSummary add(Classification classification) {
        return switch (classification) {
            case SAFE_TO_DELETE -> new TypeSummary(total + 1, safeToDelete + 1, requiresReview, unknown);
            case REQUIRES_REVIEW -> new TypeSummary(total + 1, safeToDelete, requiresReview + 1, unknown);
            case UNKNOWN -> new TypeSummary(total + 1, safeToDelete, requiresReview, unknown + 1);
        };
    }
}
