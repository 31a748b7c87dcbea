package com.di.schemanova.agent.roles;

import com.di.schemanova.agent.SampleDatasets;
import com.di.schemanova.agent.cleaning.CleaningNormalizer;
import com.di.schemanova.agent.cleaning.Dataset;
import com.di.schemanova.agent.cleaning.RawDataset;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.keys.KeyCandidateDetector;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.ColumnProfiler;
import com.di.schemanova.config.InferenceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for TableRoleClassifier.
 */
@DisplayName("TableRoleClassifier Tests")
class TableRoleClassifierTest {

    private CleaningNormalizer normalizer;
    private ColumnProfiler profiler;
    private KeyCandidateDetector detector;
    private TableRoleClassifier classifier;

    @BeforeEach
    void setUp() {
        InferenceProperties properties = new InferenceProperties();
        normalizer = new CleaningNormalizer(properties);
        profiler = new ColumnProfiler(properties);
        detector = new KeyCandidateDetector(properties);
        classifier = new TableRoleClassifier(properties);
    }

    private TableRoleAssignment classify(RawDataset raw) {
        Dataset dataset = normalizer.clean(raw).getDataset();
        List<ColumnProfile> profiles = profiler.profile(dataset);
        List<KeyCandidate> keys = detector.detect(dataset, profiles);
        return classifier.classify(raw.getName(), profiles, keys);
    }

    // ============================================================================
    // Scenario Tests
    // ============================================================================

    @Test
    @DisplayName("Orders should be classified as a fact table")
    void testClassify_OrdersIsFact() {
        TableRoleAssignment assignment = classify(SampleDatasets.orders());
        assertEquals(TableRole.FACT, assignment.getRole());
        assertEquals("Orders", assignment.getDatasetName());
        assertFalse(assignment.getRationale().isBlank());
    }

    @Test
    @DisplayName("Customers should be classified as a dimension table")
    void testClassify_CustomersIsDimension() {
        assertEquals(TableRole.DIMENSION, classify(SampleDatasets.customers()).getRole());
    }

    @Test
    @DisplayName("A single-row dataset should be a reference table")
    void testClassify_SingleRowIsReference() {
        TableRoleAssignment assignment = classify(RawDataset.of("one", List.of("code", "label"), List.of(List.of("X", "Unknown"))));
        assertEquals(TableRole.REFERENCE, assignment.getRole());
    }

    @Test
    @DisplayName("A small unkeyed lookup list should be a reference table")
    void testClassify_SmallLookup() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            // every combination once, so no column or pair identifies a row
            rows.add(List.of((i & 1) == 0 ? "lo" : "hi", (i & 2) == 0 ? "lo" : "hi", (i & 4) == 0 ? "lo" : "hi"));
        }
        assertEquals(TableRole.REFERENCE, classify(RawDataset.of("levels", List.of("a", "b", "c"), rows)).getRole());
    }

    @Test
    @DisplayName("Numeric-heavy table below the fact row floor should be unclassified with reasons")
    void testClassify_Unclassified() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            rows.add(List.of(i % 5, i % 7, "tag" + (i % 2)));
        }
        TableRoleAssignment assignment = classify(RawDataset.of("readings", List.of("a", "b", "tag"), rows));

        assertEquals(TableRole.UNCLASSIFIED, assignment.getRole());
        assertTrue(assignment.getRationale().startsWith("Inconclusive:"));
        assertTrue(assignment.getRationale().contains("no confident key"));
    }

    // ============================================================================
    // Robustness Tests
    // ============================================================================

    @Test
    @DisplayName("Should tolerate empty and null inputs")
    void testClassify_EmptyInputs() {
        assertNotNull(classifier.classify("empty", List.of(), List.of()).getRole());
        assertNotNull(classifier.classify("nulls", null, null).getRole());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 99L, 2024L})
    @DisplayName("Should never throw and always return a defined role for random tables")
    void testClassify_RandomTablesNeverThrow(long seed) {
        Random random = new Random(seed);
        int columns = 1 + random.nextInt(5);
        int rowCount = random.nextInt(300);
        List<String> names = new ArrayList<>();
        for (int c = 0; c < columns; c++) {
            names.add("c" + c);
        }
        List<List<Object>> rows = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            List<Object> row = new ArrayList<>();
            for (int c = 0; c < columns; c++) {
                row.add(random.nextBoolean() ? random.nextInt(50) : "t" + random.nextInt(rowCount + 1));
            }
            rows.add(row);
        }

        TableRoleAssignment assignment = assertDoesNotThrow(() -> classify(RawDataset.of("random", names, rows)));
        assertTrue(List.of(TableRole.values()).contains(assignment.getRole()));
    }

    @Test
    @DisplayName("Signals should treat a key spanning every column as covering the row")
    void testSignals_KeyCoversWholeRow() {
        Dataset dataset = normalizer.clean(RawDataset.of("pairs", List.of("x", "y"), List.of(
                List.of(1, 1), List.of(1, 2), List.of(2, 1), List.of(2, 2)))).getDataset();
        List<ColumnProfile> profiles = profiler.profile(dataset);
        List<KeyCandidate> keys = detector.detect(dataset, profiles);

        RoleSignals signals = classifier.signals(profiles, keys);
        assertTrue(signals.hasConfidentKey());
        assertTrue(signals.confidentKeyCoversWholeRow());
        assertEquals(1.0, signals.numericRatio());
    }
}
