package com.di.schemanova.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for MetricsCollector.
 */
@DisplayName("MetricsCollector Tests")
class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MetricsCollector(registry);
    }

    @Test
    @DisplayName("Should keep one timer per stage tag")
    void testRecordStage() {
        collector.recordStage("cleaning", 10);
        collector.recordStage("cleaning", 30);
        collector.recordStage("profiling", 5);

        var cleaning = registry.get(MetricsCollector.STAGE_TIMER).tag("stage", "cleaning").timer();
        assertEquals(2, cleaning.count());
        assertEquals(40.0, cleaning.totalTime(TimeUnit.MILLISECONDS), 1e-9);
        assertEquals(1, registry.get(MetricsCollector.STAGE_TIMER).tag("stage", "profiling").timer().count());
    }

    @Test
    @DisplayName("Should count dataset outcomes by status tag")
    void testDatasetOutcomes() {
        collector.recordDatasetOk();
        collector.recordDatasetOk();
        collector.recordDatasetDegraded();
        collector.recordDatasetFailed();

        assertEquals(2.0, registry.get("schemanova.datasets.total").tag("status", "ok").counter().count());
        assertEquals(1.0, registry.get("schemanova.datasets.total").tag("status", "degraded").counter().count());
        assertEquals(1.0, registry.get("schemanova.datasets.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("Should record runs and relationship distributions")
    void testRunsAndRelationships() {
        collector.recordRun(120);
        collector.recordRelationships(3);
        collector.recordRelationshipStrength(0.9);
        collector.recordRelationshipStrength(0.5);

        assertEquals(1.0, registry.get("schemanova.run.total").counter().count());
        assertEquals(1, registry.get("schemanova.run.duration").timer().count());
        assertEquals(3.0, registry.get("schemanova.relationships.count").summary().totalAmount());
        assertEquals(2, registry.get("schemanova.relationships.strength").summary().count());
        assertEquals(0.9, registry.get("schemanova.relationships.strength").summary().max(), 1e-9);
    }
}
