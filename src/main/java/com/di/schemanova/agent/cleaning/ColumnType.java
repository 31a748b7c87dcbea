package com.di.schemanova.agent.cleaning;

/**
 * Storage type of a canonical column, decided by the Cleaning Normalizer.
 * Values are held as {@code String}, {@code BigDecimal}, {@code Boolean} or
 * {@code LocalDate}/{@code LocalDateTime} respectively; missing cells are {@code null}.
 */
public enum ColumnType {
    TEXT,
    NUMERIC,
    BOOLEAN,
    DATE
}
