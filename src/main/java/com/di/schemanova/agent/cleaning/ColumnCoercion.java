package com.di.schemanova.agent.cleaning;

import lombok.Builder;
import lombok.Value;

/**
 * How one column was typed during cleaning.
 */
@Value
@Builder
public class ColumnCoercion {
    String column;
    ColumnType type;
    /** Some, but not all, non-missing values parsed as numbers; the column stayed text. */
    boolean numericAmbiguous;
    /** Cells of a date-tagged column that failed to parse and became missing. */
    int dateParseFailures;
    /** Cells converted from text to a typed value. */
    int convertedCells;

    /** Short human-readable note for the profile, or {@code null} when nothing noteworthy happened. */
    public String describe() {
        if (numericAmbiguous) {
            return "mixed numeric and non-numeric values; kept as text";
        }
        if (dateParseFailures > 0) {
            return dateParseFailures + " unparseable date value(s) set to missing";
        }
        if (convertedCells > 0 && type != ColumnType.TEXT) {
            return convertedCells + " text value(s) coerced to " + type.name().toLowerCase();
        }
        return null;
    }
}
