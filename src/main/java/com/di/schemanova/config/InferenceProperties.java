package com.di.schemanova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for every heuristic threshold used by the inference stages.
 *
 * <p>The thresholds are tuned by example, not derived from a model, so all of them live in
 * YAML and can be adjusted per deployment without a code change. The defaults below match
 * the shipped {@code application.yml}.
 *
 * <pre>
 * schemanova:
 *   inference:
 *     cleaning:
 *       date-parse-threshold: 0.90
 *     keys:
 *       max-missing-ratio: 0.05
 *       high-confidence-uniqueness: 0.98
 *     roles:
 *       reference-row-floor: 10
 *     relationships:
 *       min-match-strength: 0.30
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "schemanova.inference")
public class InferenceProperties {

    private Cleaning cleaning = new Cleaning();
    private Profiler profiler = new Profiler();
    private Keys keys = new Keys();
    private Roles roles = new Roles();
    private Relationships relationships = new Relationships();
    private Dictionary dictionary = new Dictionary();
    private Execution execution = new Execution();
    private Store store = new Store();

    // ------------------------------------------------------------------ //
    // Cleaning Normalizer                                                 //
    // ------------------------------------------------------------------ //

    @Data
    public static class Cleaning {
        /** Minimum share of non-missing values that must parse as dates before a column is date-tagged. */
        private double dateParseThreshold = 0.90;

        /** Text values (case-insensitive, after trimming) that are treated as missing. */
        private List<String> nullTokens = new ArrayList<>(List.of("null", "nan", "n/a", "na", "none"));
    }

    // ------------------------------------------------------------------ //
    // Column Profiler                                                     //
    // ------------------------------------------------------------------ //

    @Data
    public static class Profiler {
        /** Distinct ratio at or above which a short text column is considered identifier-like. */
        private double identifierDistinctRatio = 0.95;

        /** Maximum average text length for an identifier-like column. */
        private double identifierMaxAvgLength = 32;

        /** Number of distinct sample values kept per column. */
        private int sampleSize = 5;
    }

    // ------------------------------------------------------------------ //
    // Key Candidate Detector                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Keys {
        /** Columns with a missing ratio above this ceiling are never key candidates. */
        private double maxMissingRatio = 0.05;

        /** Weight of the missing-ratio penalty subtracted from the distinct ratio. */
        private double missingPenaltyWeight = 1.0;

        /** Minimum score for a single column to be listed as a candidate. */
        private double minCandidateScore = 0.90;

        /** Uniqueness a key must reach (with no missing values) to count as confident. */
        private double highConfidenceUniqueness = 0.98;

        /** Upper bound on the column pairs tested for a composite key. */
        private int maxPairCombinations = 45;

        /** Datasets with fewer rows yield no key candidates. */
        private int minRowsForKeys = 2;
    }

    // ------------------------------------------------------------------ //
    // Table Role Classifier                                               //
    // ------------------------------------------------------------------ //

    @Data
    public static class Roles {
        /** Below this row count a table without a confident key is a reference table. */
        private long referenceRowFloor = 10;

        /** Numeric-column ratio above which a table looks like a fact table. */
        private double factNumericRatio = 0.5;

        /** Minimum row count for a fact table. */
        private long factRowFloor = 100;

        /** Numeric-column ratio at or below which a keyed table is a dimension. */
        private double dimensionMaxNumericRatio = 0.5;
    }

    // ------------------------------------------------------------------ //
    // Relationship Detector                                               //
    // ------------------------------------------------------------------ //

    @Data
    public static class Relationships {
        /** Candidates are emitted only when match strength is strictly above this value. */
        private double minMatchStrength = 0.30;

        /** Weight of the column-name similarity component. */
        private double nameWeight = 0.25;

        /** Weight of the value-overlap component. */
        private double overlapWeight = 0.75;

        /** Name score when one normalized name contains the other. Exact match scores 1.0. */
        private double substringNameScore = 0.6;

        /** min/max distinct-count ratio required for text-like column pairs. */
        private double textCardinalitySimilarity = 0.5;
    }

    // ------------------------------------------------------------------ //
    // Data Dictionary Builder                                             //
    // ------------------------------------------------------------------ //

    @Data
    public static class Dictionary {
        /** Text columns with a distinct ratio below this are described as categorical. */
        private double categoricalDistinctRatio = 0.2;
    }

    // ------------------------------------------------------------------ //
    // Execution                                                           //
    // ------------------------------------------------------------------ //

    @Data
    public static class Execution {
        /** When true, cleaning, profiling, key detection and role classification run per dataset on a worker pool. */
        private boolean parallel = false;

        /** Worker pool size used when {@link #parallel} is enabled. */
        private int workerThreads = 4;
    }

    // ------------------------------------------------------------------ //
    // Analysis run store                                                  //
    // ------------------------------------------------------------------ //

    @Data
    public static class Store {
        private int maxRuns = 100;
        private int expireAfterWriteMinutes = 60;
    }
}
