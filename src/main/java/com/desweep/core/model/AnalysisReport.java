package com.desweep.core.model;

import java.util.List;
import java.util.Map;

/**
 * Result of analysing a batch of target entities.
 *
 * @param runId           correlation id of the analysis run
 * @param summary         counts by classification and type
 * @param safeToDelete    verdicts classified {@link Classification#SAFE_TO_DELETE}
 * @param requiresReview  verdicts classified {@link Classification#REQUIRES_REVIEW}
 * @param unknown         verdicts classified {@link Classification#UNKNOWN}
 * @param all             every unique dependency, in discovery order
 * @param entityMapping   input entity primary key to the dependencies found for it
 * @param dataLoadSummary counts of the metadata the analysis ran against
 */
public record AnalysisReport(
    String runId,
    AnalysisSummary summary,
    List<ClassifiedDependency> safeToDelete,
    List<ClassifiedDependency> requiresReview,
    List<ClassifiedDependency> unknown,
    List<ClassifiedDependency> all,
    Map<String, List<DependencyRef>> entityMapping,
    DatasetSummary dataLoadSummary
) {}
