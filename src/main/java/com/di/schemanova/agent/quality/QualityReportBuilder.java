package com.di.schemanova.agent.quality;

import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.cleaning.ColumnCoercion;
import com.di.schemanova.agent.cleaning.ColumnType;
import com.di.schemanova.agent.profiler.ColumnProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarizes cleaning outcome and column profiles into a {@link QualityReport}.
 */
@Component
public class QualityReportBuilder {

    public QualityReport build(CleaningResult cleaned, List<ColumnProfile> profiles) {
        long rows = cleaned.getDataset().rowCount();
        int columns = cleaned.getDataset().columnCount();
        long missing = 0;
        List<ColumnQuality> columnQuality = new ArrayList<>(profiles.size());
        for (ColumnProfile p : profiles) {
            missing += p.getMissingCount();
            columnQuality.add(new ColumnQuality(
                    p.getColumnName(),
                    p.getStorageType(),
                    p.getMissingCount(),
                    Math.round(p.getMissingRatio() * 10_000) / 100.0,
                    p.getDistinctCount(),
                    p.isFullyUnique()));
        }

        List<String> numeric = new ArrayList<>();
        List<String> dates = new ArrayList<>();
        List<String> ambiguous = new ArrayList<>();
        for (ColumnCoercion c : cleaned.getCoercions().values()) {
            if (c.getType() == ColumnType.NUMERIC && c.getConvertedCells() > 0) numeric.add(c.getColumn());
            if (c.getType() == ColumnType.DATE) dates.add(c.getColumn());
            if (c.isNumericAmbiguous()) ambiguous.add(c.getColumn());
        }

        long cells = rows * columns;
        return QualityReport.builder()
                .datasetName(cleaned.getDataset().getName())
                .rowCount(rows)
                .columnCount(columns)
                .duplicateRowsRemoved(cleaned.getDuplicateRowsRemoved())
                .missingCells(missing)
                .completeness(cells == 0 ? 1.0 : (double) (cells - missing) / cells)
                .numericCoercedColumns(List.copyOf(numeric))
                .dateTaggedColumns(List.copyOf(dates))
                .ambiguousColumns(List.copyOf(ambiguous))
                .cleaningNotes(cleaned.getNotes())
                .columns(List.copyOf(columnQuality))
                .build();
    }
}
