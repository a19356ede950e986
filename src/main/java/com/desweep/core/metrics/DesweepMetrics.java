package com.desweep.core.metrics;

import com.desweep.core.model.Classification;
import com.desweep.core.model.DependencyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for metadata loading and dependency analysis.
 */
@Service
public class DesweepMetrics {

    private final MeterRegistry registry;

    public DesweepMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source "memory", "disk" or "live"
     */
    public void recordLoad(String source, long ms) {
        Timer.builder("desweep.load.duration")
                .tag("source", source)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSourceFailure(String stage) {
        Counter.builder("desweep.load.source_failures")
                .description("Metadata collections degraded to empty")
                .tag("source", stage)
                .register(registry)
                .increment();
    }

    public void recordCollectionSize(String stage, int size) {
        DistributionSummary.builder("desweep.load.collection_size")
                .tag("source", stage)
                .register(registry)
                .record(size);
    }

    public void recordCacheWrite(boolean success) {
        Counter.builder("desweep.cache.writes")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordScan(int entities, long ms) {
        Timer.builder("desweep.scan.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("desweep.scan.entities")
                .register(registry)
                .record(entities);
    }

    public void recordClassification(DependencyType type, Classification classification) {
        Counter.builder("desweep.classifications.total")
                .tag("type", type.name())
                .tag("classification", classification.name())
                .register(registry)
                .increment();
    }

    public void recordMalformedRecord(DependencyType type) {
        Counter.builder("desweep.scan.malformed_records")
                .description("Records skipped during scanning because they could not be read")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordAnalysis(long ms) {
        Timer.builder("desweep.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
