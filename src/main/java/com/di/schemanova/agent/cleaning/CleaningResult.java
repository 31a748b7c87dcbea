package com.di.schemanova.agent.cleaning;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of the Cleaning Normalizer: the canonical dataset plus what was done to get there.
 */
@Value
@Builder
public class CleaningResult {
    Dataset dataset;
    /** Exact duplicate rows dropped after normalization. */
    int duplicateRowsRemoved;
    /** Per-column typing outcome, in column order. */
    Map<String, ColumnCoercion> coercions;
    /** Structural repairs (renamed headers, padded or truncated rows). */
    @Singular
    List<String> notes;

    public Optional<ColumnCoercion> coercionFor(String column) {
        return Optional.ofNullable(coercions.get(column));
    }
}
