package com.di.schemanova.model;

/**
 * What went wrong (or degraded) while analysing one dataset.
 */
public enum IssueCode {
    /** Structurally invalid input, e.g. no columns. The dataset is skipped. */
    SHAPE_ERROR,
    /** Too few rows for key detection and role classification to be meaningful. */
    INSUFFICIENT_DATA,
    /** A column mixed numeric and non-numeric values and was left as text. */
    TYPE_COERCION_AMBIGUOUS,
    /** A date-tagged column had values that did not parse and were set to missing. */
    DATE_PARSE_FAILURES,
    /** Unexpected failure inside one of the stages. */
    PROCESSING_ERROR
}
