package com.di.schemanova.agent.roles;

/**
 * Structural signals the role rules look at, computed once per dataset.
 *
 * @param rowCount                      rows in the canonical dataset
 * @param columnCount                   columns in the canonical dataset
 * @param numericRatio                  numeric columns / all columns (0 with no columns)
 * @param hasConfidentKey               some key candidate is confident
 * @param confidentKeyCoversWholeRow    a confident key spans every column of the table
 * @param avgNonNumericDistinctRatio    mean distinct ratio over non-numeric columns (0 when none)
 */
public record RoleSignals(long rowCount,
                          int columnCount,
                          double numericRatio,
                          boolean hasConfidentKey,
                          boolean confidentKeyCoversWholeRow,
                          double avgNonNumericDistinctRatio) {

    String describe() {
        return String.format("rows=%d, numericRatio=%.2f, confidentKey=%s, avgNonNumericDistinctRatio=%.2f",
                rowCount, numericRatio, hasConfidentKey, avgNonNumericDistinctRatio);
    }
}
