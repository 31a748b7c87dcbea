package com.di.schemanova.agent.keys;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A column, or ordered column pair, hypothesized to uniquely identify rows of a dataset.
 */
@Value
@Builder
public class KeyCandidate {
    String datasetName;
    List<String> columns;
    /** Distinct values (or value tuples) divided by the relevant row count. */
    double uniquenessRatio;
    /** Share of rows where at least one key column is missing. */
    double nullRatio;
    /** Uniqueness minus the missing-value penalty, in [0, 1]. */
    double confidence;

    public boolean isComposite() {
        return columns.size() > 1;
    }

    /** True for a single-column candidate on exactly this column. */
    public boolean isSingleColumn(String column) {
        return columns.size() == 1 && columns.get(0).equals(column);
    }

    /** Confident keys are (nearly) unique and never missing. */
    public boolean isConfident(double uniquenessThreshold) {
        return nullRatio == 0.0 && uniquenessRatio >= uniquenessThreshold;
    }
}
