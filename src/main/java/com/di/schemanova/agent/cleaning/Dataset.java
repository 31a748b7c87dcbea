package com.di.schemanova.agent.cleaning;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical (cleaned) dataset. Immutable once built: the Cleaning Normalizer is the only
 * producer and every later stage reads it.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "rows")
public final class Dataset {

    private final String name;
    private final List<String> columns;
    private final List<ColumnType> columnTypes;
    private final List<List<Object>> rows;

    public Dataset(String name, List<String> columns, List<ColumnType> columnTypes, List<List<Object>> rows) {
        if (columns.size() != columnTypes.size()) {
            throw new IllegalArgumentException("columns and columnTypes differ in size for dataset " + name);
        }
        this.name = name;
        this.columns = List.copyOf(columns);
        this.columnTypes = List.copyOf(columnTypes);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    /** Index of the named column, or -1 when absent. */
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public ColumnType typeOf(String column) {
        int idx = requireIndex(column);
        return columnTypes.get(idx);
    }

    /** Values of one column in row order, {@code null} for missing cells. */
    public List<Object> columnValues(String column) {
        int idx = requireIndex(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(idx));
        }
        return values;
    }

    private int requireIndex(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column '" + column + "' in dataset " + name);
        }
        return idx;
    }
}
