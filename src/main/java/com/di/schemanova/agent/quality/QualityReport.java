package com.di.schemanova.agent.quality;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Dataset-level data quality summary.
 */
@Value
@Builder
public class QualityReport {
    String datasetName;
    long rowCount;
    int columnCount;
    int duplicateRowsRemoved;
    long missingCells;
    /** Share of non-missing cells, 1.0 for an empty dataset. */
    double completeness;
    List<String> numericCoercedColumns;
    List<String> dateTaggedColumns;
    List<String> ambiguousColumns;
    List<String> cleaningNotes;
    List<ColumnQuality> columns;
}
