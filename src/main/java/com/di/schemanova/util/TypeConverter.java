package com.di.schemanova.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Conversions used when coercing raw cells into canonical column values.
 *
 * <p>All methods are null-safe and never throw on bad input: a value that cannot be
 * converted yields {@code null}, and the caller decides whether that is a failure.
 */
public final class TypeConverter {

    /** Thousands separators, currency and percent symbols removed before numeric parsing. */
    private static final Pattern NUMERIC_NOISE = Pattern.compile("[,%$₹€£\\s]");

    private static final Pattern NUMERIC_SHAPE = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    /** Largest number of integer or fractional digits a canonical numeric value may expand to. */
    static final int MAX_MAGNITUDE_DIGITS = 1000;

    private TypeConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a cell to a canonical numeric value.
     * Numbers keep their value; text is stripped of separators and symbols first.
     * Trailing zeros are stripped so that {@code 1}, {@code 1.0} and {@code "1.00"} compare equal.
     * Values that would expand beyond {@link #MAX_MAGNITUDE_DIGITS} integer or fractional digits
     * (e.g. {@code "1e999999999"}) are not numeric.
     *
     * @return the numeric value, or {@code null} when the cell is not numeric or out of range
     */
    public static BigDecimal toNumeric(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return normalize((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            return normalize(new BigDecimal((BigInteger) value));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return normalize(BigDecimal.valueOf(d));
        }
        if (value instanceof Number) {
            return normalize(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof CharSequence) {
            String cleaned = NUMERIC_NOISE.matcher(value.toString()).replaceAll("");
            if (cleaned.isEmpty() || !NUMERIC_SHAPE.matcher(cleaned).matches()) {
                return null;
            }
            try {
                return normalize(new BigDecimal(cleaned));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Converts a cell to a boolean. Accepts {@link Boolean} values and the text
     * {@code true}/{@code false} (case-insensitive).
     *
     * @return the boolean, or {@code null} when the cell is not boolean
     */
    public static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Text rendering of a canonical value. Numbers are rendered without exponent.
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        if (Math.abs((long) stripped.scale()) > MAX_MAGNITUDE_DIGITS || Math.abs(integerDigits) > MAX_MAGNITUDE_DIGITS) {
            return null;
        }
        // keep integers at scale 0 so that equal values hash equally
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
