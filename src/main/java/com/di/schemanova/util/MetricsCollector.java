package com.di.schemanova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for schema inference runs: per-stage timings, dataset outcomes and
 * relationship counts.
 */
@Slf4j
@Component
public class MetricsCollector {

    static final String STAGE_TIMER = "schemanova.stage.duration";

    private final MeterRegistry meterRegistry;

    private final Counter runCounter;
    private final Timer runTimer;
    private final Counter datasetsAnalysedCounter;
    private final Counter datasetsDegradedCounter;
    private final Counter datasetsFailedCounter;
    private final DistributionSummary relationshipCountDistribution;
    private final DistributionSummary relationshipStrengthDistribution;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runCounter = Counter.builder("schemanova.run.total")
                .description("Total number of analysis runs")
                .register(meterRegistry);

        this.runTimer = Timer.builder("schemanova.run.duration")
                .description("End-to-end time of an analysis run")
                .register(meterRegistry);

        this.datasetsAnalysedCounter = Counter.builder("schemanova.datasets.total")
                .description("Datasets analysed")
                .tag("status", "ok")
                .register(meterRegistry);

        this.datasetsDegradedCounter = Counter.builder("schemanova.datasets.total")
                .description("Datasets analysed with degraded signal")
                .tag("status", "degraded")
                .register(meterRegistry);

        this.datasetsFailedCounter = Counter.builder("schemanova.datasets.total")
                .description("Datasets that failed analysis")
                .tag("status", "failed")
                .register(meterRegistry);

        this.relationshipCountDistribution = DistributionSummary.builder("schemanova.relationships.count")
                .description("Relationship candidates per run")
                .register(meterRegistry);

        this.relationshipStrengthDistribution = DistributionSummary.builder("schemanova.relationships.strength")
                .description("Match strength of emitted relationship candidates")
                .register(meterRegistry);
    }

    // ============================================================================
    // Stages
    // ============================================================================

    /**
     * Records the duration of one pipeline stage, e.g. "cleaning" or "relationships".
     */
    public void recordStage(String stage, long durationMs) {
        Timer.builder(STAGE_TIMER)
                .description("Time spent in one inference stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded stage: stage={}, durationMs={}", stage, durationMs);
    }

    // ============================================================================
    // Runs and datasets
    // ============================================================================

    public void recordRun(long durationMs) {
        runCounter.increment();
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDatasetOk() {
        datasetsAnalysedCounter.increment();
    }

    public void recordDatasetDegraded() {
        datasetsDegradedCounter.increment();
    }

    public void recordDatasetFailed() {
        datasetsFailedCounter.increment();
    }

    // ============================================================================
    // Relationships
    // ============================================================================

    public void recordRelationships(int count) {
        relationshipCountDistribution.record(count);
    }

    public void recordRelationshipStrength(double strength) {
        relationshipStrengthDistribution.record(strength);
    }
}
