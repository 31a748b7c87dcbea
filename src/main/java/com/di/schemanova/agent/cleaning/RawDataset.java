package com.di.schemanova.agent.cleaning;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dataset as handed over by the ingestion layer: column names plus rows of heterogeneous
 * scalar values. Nothing is normalized yet; rows may be ragged and cells may be {@code null}.
 * Built through {@link #of}, which never leaves columns or rows null.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RawDataset {
    String name;
    List<String> columns;
    List<List<Object>> rows;

    public static RawDataset of(String name, List<String> columns, List<List<Object>> rows) {
        List<String> cols = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        return new RawDataset(name, cols, Collections.unmodifiableList(copy));
    }
}
