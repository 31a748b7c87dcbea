package com.di.schemanova.agent.profiler;

import com.di.schemanova.agent.SampleDatasets;
import com.di.schemanova.agent.cleaning.CleaningNormalizer;
import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.cleaning.ColumnType;
import com.di.schemanova.agent.cleaning.RawDataset;
import com.di.schemanova.config.InferenceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ColumnProfiler.
 */
@DisplayName("ColumnProfiler Tests")
class ColumnProfilerTest {

    private CleaningNormalizer normalizer;
    private ColumnProfiler profiler;

    @BeforeEach
    void setUp() {
        InferenceProperties properties = new InferenceProperties();
        normalizer = new CleaningNormalizer(properties);
        profiler = new ColumnProfiler(properties);
    }

    private List<ColumnProfile> profile(RawDataset raw) {
        return profiler.profile(normalizer.clean(raw));
    }

    private static ColumnProfile column(List<ColumnProfile> profiles, String name) {
        return profiles.stream().filter(p -> p.getColumnName().equals(name)).findFirst().orElseThrow();
    }

    // ============================================================================
    // Count Invariant Tests
    // ============================================================================

    static Stream<RawDataset> datasets() {
        return Stream.of(
                SampleDatasets.orders(),
                SampleDatasets.customers(),
                RawDataset.of("sparse", List.of("a", "b"), List.of(
                        Arrays.asList("x", null),
                        Arrays.asList(null, null),
                        Arrays.asList("y", "1"))),
                RawDataset.of("no_rows", List.of("a"), List.of()));
    }

    @ParameterizedTest(name = "[{index}] dataset")
    @MethodSource("datasets")
    @DisplayName("Missing plus non-missing should equal row count and ratios stay in [0, 1]")
    void testProfile_CountInvariants(RawDataset raw) {
        for (ColumnProfile p : profile(raw)) {
            assertEquals(p.getRowCount(), p.getMissingCount() + p.getNonMissingCount(), p.getColumnName());
            assertTrue(p.getDistinctRatio() >= 0.0 && p.getDistinctRatio() <= 1.0, p.getColumnName());
            assertTrue(p.getMissingRatio() >= 0.0 && p.getMissingRatio() <= 1.0, p.getColumnName());
            assertTrue(p.getDistinctCount() <= p.getNonMissingCount(), p.getColumnName());
        }
    }

    @Test
    @DisplayName("Should return one profile per column in column order")
    void testProfile_Order() {
        List<ColumnProfile> profiles = profile(SampleDatasets.orders());
        assertEquals(List.of("order_id", "customer_id", "amount"),
                profiles.stream().map(ColumnProfile::getColumnName).toList());
        for (int i = 0; i < profiles.size(); i++) {
            assertEquals(i, profiles.get(i).getPosition());
        }
    }

    @Test
    @DisplayName("Should report zero ratios for an all-missing column")
    void testProfile_AllMissing() {
        RawDataset raw = RawDataset.of("t", List.of("id", "empty"), List.of(
                Arrays.asList("1", null), Arrays.asList("2", "")));
        ColumnProfile p = column(profile(raw), "empty");

        assertEquals(2, p.getMissingCount());
        assertEquals(0, p.getNonMissingCount());
        assertEquals(0.0, p.getDistinctRatio());
        assertEquals(1.0, p.getMissingRatio());
        assertEquals(SemanticType.TEXT, p.getSemanticType());
        assertTrue(p.getSampleValues().isEmpty());
    }

    @Test
    @DisplayName("Should profile a single-row, single-column dataset")
    void testProfile_SingleCell() {
        List<ColumnProfile> profiles = profile(RawDataset.of("t", List.of("only"), List.of(List.of("value"))));
        assertEquals(1, profiles.size());
        ColumnProfile p = profiles.get(0);
        assertEquals(1, p.getRowCount());
        assertEquals(1.0, p.getDistinctRatio());
        assertTrue(p.isFullyUnique());
    }

    // ============================================================================
    // Semantic Type Tests
    // ============================================================================

    @Test
    @DisplayName("Should type the sample customer columns")
    void testProfile_CustomerSemanticTypes() {
        List<ColumnProfile> profiles = profile(SampleDatasets.customers());
        assertEquals(SemanticType.NUMERIC, column(profiles, "customer_id").getSemanticType());
        assertEquals(SemanticType.IDENTIFIER, column(profiles, "name").getSemanticType());
        assertEquals(SemanticType.TEXT, column(profiles, "region").getSemanticType());
    }

    static Stream<Arguments> semanticTypeCases() {
        return Stream.of(
                Arguments.of(ColumnType.BOOLEAN, 10L, 2L, 0.2, 4.5, SemanticType.BOOLEAN),
                Arguments.of(ColumnType.NUMERIC, 10L, 10L, 1.0, 2.0, SemanticType.NUMERIC),
                Arguments.of(ColumnType.DATE, 10L, 10L, 1.0, 10.0, SemanticType.DATE),
                Arguments.of(ColumnType.TEXT, 10L, 10L, 1.0, 8.0, SemanticType.IDENTIFIER),
                Arguments.of(ColumnType.TEXT, 10L, 10L, 1.0, 120.0, SemanticType.TEXT),
                Arguments.of(ColumnType.TEXT, 10L, 3L, 0.3, 5.0, SemanticType.TEXT),
                Arguments.of(ColumnType.TEXT, 0L, 0L, 0.0, 0.0, SemanticType.TEXT));
    }

    @ParameterizedTest
    @MethodSource("semanticTypeCases")
    @DisplayName("Should apply semantic-type rules in order")
    void testDecideSemanticType(ColumnType storage, long nonMissing, long distinct, double distinctRatio,
                                double avgLength, SemanticType expected) {
        ColumnStats stats = new ColumnStats(storage, 10, nonMissing, distinct, distinctRatio, avgLength);
        assertEquals(expected, profiler.decideSemanticType(stats));
    }

    // ============================================================================
    // Detail Tests
    // ============================================================================

    @Test
    @DisplayName("Should compute numeric min, max and mean")
    void testProfile_NumericStats() {
        RawDataset raw = RawDataset.of("t", List.of("v"), List.of(List.of("1"), List.of("2"), List.of("3.0")));
        ColumnProfile p = profile(raw).get(0);
        assertEquals(new BigDecimal("1"), p.getNumericMin());
        assertEquals(new BigDecimal("3"), p.getNumericMax());
        assertEquals(2.0, p.getNumericMean(), 1e-9);
    }

    @Test
    @DisplayName("Should keep at most the configured number of distinct samples, in row order")
    void testProfile_Samples() {
        List<List<Object>> rows = new ArrayList<>();
        for (String v : List.of("b", "a", "b", "c", "d", "e", "f", "g")) {
            rows.add(List.of(v, rows.size()));
        }
        ColumnProfile p = profile(RawDataset.of("t", List.of("letter", "n"), rows)).get(0);
        assertEquals(List.of("b", "a", "c", "d", "e"), p.getSampleValues());
    }

    @Test
    @DisplayName("Should carry the cleaning note of an ambiguous column")
    void testProfile_CoercionNote() {
        CleaningResult cleaned = normalizer.clean(RawDataset.of("t", List.of("v"),
                List.of(List.of("10"), List.of("ten"))));
        assertNotNull(profiler.profile(cleaned).get(0).getCoercionNote());
        assertNull(profiler.profile(cleaned.getDataset()).get(0).getCoercionNote());
    }

    @Test
    @DisplayName("Ratio should be zero for a zero denominator")
    void testRatio_ZeroDenominator() {
        assertEquals(0.0, ColumnProfiler.ratio(5, 0));
        assertEquals(0.5, ColumnProfiler.ratio(1, 2));
    }
}
