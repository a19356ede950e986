package com.desweep.core.model;

import java.util.Map;

/**
 * Headline counts of an {@link AnalysisReport}. Always states UNKNOWN explicitly
 * so partial-data runs are visible.
 */
public record AnalysisSummary(
    int totalEntities,
    int totalRawDependencies,
    int uniqueDependencies,
    int safeToDelete,
    int requiresReview,
    int unknown,
    Map<DependencyType, TypeSummary> byType
) {}
