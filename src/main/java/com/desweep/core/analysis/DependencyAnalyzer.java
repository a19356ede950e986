package com.desweep.core.analysis;

import com.desweep.core.classify.ClassificationEngine;
import com.desweep.core.events.AuditEvent;
import com.desweep.core.events.EventBus;
import com.desweep.core.loader.BulkDataset;
import com.desweep.core.loader.BulkMetadataLoader;
import com.desweep.core.loader.MetadataCacheContext;
import com.desweep.core.logging.MdcContext;
import com.desweep.core.metrics.DesweepMetrics;
import com.desweep.core.model.AnalysisReport;
import com.desweep.core.model.AnalysisSummary;
import com.desweep.core.model.ClassificationVerdict;
import com.desweep.core.model.ClassifiedDependency;
import com.desweep.core.model.DependencyRecord;
import com.desweep.core.model.DependencyRef;
import com.desweep.core.model.DependencyType;
import com.desweep.core.model.StalenessThreshold;
import com.desweep.core.model.TargetEntity;
import com.desweep.core.model.TypeSummary;
import com.desweep.core.scanner.DependencyScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the scanner and classification engine over a batch of entities.
 *
 * <p>The dataset is loaded once for the whole batch. Records found for several
 * entities are merged by {@code (type, id)} and classified once.
 */
@Service
public class DependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final BulkMetadataLoader loader;
    private final DependencyScanner scanner;
    private final ClassificationEngine engine;
    private final EventBus eventBus;
    private final DesweepMetrics metrics;
    private final Clock clock;

    public DependencyAnalyzer(BulkMetadataLoader loader, DependencyScanner scanner, ClassificationEngine engine,
                              EventBus eventBus, DesweepMetrics metrics, Clock clock) {
        this.loader = loader;
        this.scanner = scanner;
        this.engine = engine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public AnalysisReport analyze(List<TargetEntity> entities, AnalysisOptions options) {
        return analyze(entities, options, new MetadataCacheContext());
    }

    public AnalysisReport analyze(List<TargetEntity> entities, AnalysisOptions options, MetadataCacheContext context) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        long start = System.currentTimeMillis();
        MdcContext.setRun(runId);
        try {
            StalenessThreshold threshold = StalenessThreshold.ofDays(options.staleDays(), clock);
            Map<String, TargetEntity> distinct = distinctByKey(entities);
            log.info("Analysing {} entities (stale after {} days)", distinct.size(), options.staleDays());

            BulkDataset dataset = loader.load(options.loadOptions(), context, runId);

            long scanStart = System.currentTimeMillis();
            Map<String, DependencyRecord> merged = new LinkedHashMap<>();
            Map<String, List<String>> keysByEntity = new LinkedHashMap<>();
            int rawCount = 0;
            int done = 0;
            for (TargetEntity entity : distinct.values()) {
                MdcContext.setEntity(runId, entity.primaryKey());
                try {
                    List<DependencyRecord> found = scanner.scan(entity, dataset);
                    rawCount += found.size();
                    List<String> keys = new ArrayList<>();
                    for (DependencyRecord record : found) {
                        merged.merge(record.key(), record, (existing, added) -> existing.withAffectedEntity(entity));
                        if (!keys.contains(record.key())) {
                            keys.add(record.key());
                        }
                    }
                    keysByEntity.put(entity.primaryKey(), keys);
                } finally {
                    MdcContext.clearEntity();
                }
                done++;
                eventBus.publish(AuditEvent.of(AuditEvent.ANALYSIS_PROGRESS, runId, entity.primaryKey(),
                        Map.of("current", done, "total", distinct.size())));
            }
            metrics.recordScan(distinct.size(), System.currentTimeMillis() - scanStart);

            Map<String, ClassifiedDependency> classified = new LinkedHashMap<>();
            for (var entry : merged.entrySet()) {
                DependencyRecord record = entry.getValue();
                ClassificationVerdict verdict = engine.classify(record, dataset, threshold);
                metrics.recordClassification(record.type(), verdict.classification());
                classified.put(entry.getKey(), new ClassifiedDependency(record, verdict));
            }

            AnalysisReport report = buildReport(runId, distinct.size(), rawCount, classified, keysByEntity, dataset);
            log.info("Analysis complete: {} unique dependencies ({} safe, {} review, {} unknown)",
                    report.summary().uniqueDependencies(), report.summary().safeToDelete(),
                    report.summary().requiresReview(), report.summary().unknown());

            metrics.recordAnalysis(System.currentTimeMillis() - start);
            eventBus.publish(AuditEvent.of(AuditEvent.ANALYSIS_COMPLETED, runId, null, Map.of(
                    "uniqueDependencies", report.summary().uniqueDependencies(),
                    "safeToDelete", report.summary().safeToDelete(),
                    "requiresReview", report.summary().requiresReview(),
                    "unknown", report.summary().unknown())));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private static Map<String, TargetEntity> distinctByKey(List<TargetEntity> entities) {
        Map<String, TargetEntity> distinct = new LinkedHashMap<>();
        for (TargetEntity entity : entities) {
            TargetEntity previous = distinct.putIfAbsent(entity.primaryKey(), entity);
            if (previous != null) {
                log.warn("Ignoring duplicate entity {}", entity.primaryKey());
            }
        }
        return distinct;
    }

    private static AnalysisReport buildReport(String runId, int entityCount, int rawCount,
                                              Map<String, ClassifiedDependency> classified,
                                              Map<String, List<String>> keysByEntity, BulkDataset dataset) {
        List<ClassifiedDependency> safe = new ArrayList<>();
        List<ClassifiedDependency> review = new ArrayList<>();
        List<ClassifiedDependency> unknown = new ArrayList<>();
        Map<DependencyType, TypeSummary> byType = new EnumMap<>(DependencyType.class);

        for (ClassifiedDependency dependency : classified.values()) {
            switch (dependency.classification()) {
                case SAFE_TO_DELETE -> safe.add(dependency);
                case REQUIRES_REVIEW -> review.add(dependency);
                case UNKNOWN -> unknown.add(dependency);
            }
            byType.merge(dependency.type(), TypeSummary.EMPTY.add(dependency.classification()),
                    (existing, ignored) -> existing.add(dependency.classification()));
        }

        Map<String, List<DependencyRef>> entityMapping = new LinkedHashMap<>();
        keysByEntity.forEach((entityKey, keys) -> entityMapping.put(entityKey,
                keys.stream().map(k -> classified.get(k).dependency().toRef()).toList()));

        var summary = new AnalysisSummary(entityCount, rawCount, classified.size(),
                safe.size(), review.size(), unknown.size(), Collections.unmodifiableMap(byType));
        return new AnalysisReport(runId, summary, List.copyOf(safe), List.copyOf(review), List.copyOf(unknown),
                List.copyOf(classified.values()), Collections.unmodifiableMap(entityMapping), dataset.summary());
    }
}
