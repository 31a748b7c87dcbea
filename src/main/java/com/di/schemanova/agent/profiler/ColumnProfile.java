package com.di.schemanova.agent.profiler;

import com.di.schemanova.agent.cleaning.ColumnType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-column statistics of a canonical dataset. Never mutated: re-cleaning a dataset
 * produces a new profile.
 */
@Value
@Builder
public class ColumnProfile {
    String datasetName;
    String columnName;
    /** Zero-based column position. */
    int position;
    ColumnType storageType;
    SemanticType semanticType;

    long rowCount;
    long missingCount;
    long nonMissingCount;
    /** missingCount / rowCount, 0 for an empty dataset. */
    double missingRatio;
    long distinctCount;
    /** distinctCount / nonMissingCount, 0 when every value is missing. */
    double distinctRatio;

    /** Mean length of the text rendering of non-missing values. */
    double avgTextLength;
    /** First distinct non-missing values in row order, bounded by the configured sample size. */
    List<Object> sampleValues;

    /** Numeric columns only, otherwise null. */
    BigDecimal numericMin;
    BigDecimal numericMax;
    Double numericMean;

    /** Cleaning note (e.g. ambiguous numeric coercion), or null. */
    String coercionNote;

    /** True when every row has a distinct, non-missing value. */
    public boolean isFullyUnique() {
        return rowCount > 0 && missingCount == 0 && distinctCount == rowCount;
    }
}
