package com.di.schemanova.agent.quality;

import com.di.schemanova.agent.cleaning.ColumnType;
import lombok.Value;

/**
 * One row of the quality table shown per dataset.
 */
@Value
public class ColumnQuality {
    String column;
    ColumnType dataType;
    long missingValues;
    double missingPercent;
    long uniqueValues;
    /** Every row carries a distinct, non-missing value. */
    boolean primaryKeyCandidate;
}
