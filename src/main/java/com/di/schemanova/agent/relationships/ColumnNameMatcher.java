package com.di.schemanova.agent.relationships;

import java.util.Locale;

/**
 * Scores how alike two column names are after lower-casing and dropping punctuation:
 * 1.0 for an exact match, the configured substring score when one contains the other,
 * 0 otherwise.
 */
final class ColumnNameMatcher {

    /** Contained names shorter than this (e.g. "a") do not count as a substring match. */
    private static final int MIN_SUBSTRING_LENGTH = 2;

    private final double substringScore;

    ColumnNameMatcher(double substringScore) {
        this.substringScore = substringScore;
    }

    double similarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.length() >= MIN_SUBSTRING_LENGTH && longer.contains(shorter)) {
            return substringScore;
        }
        return 0.0;
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }
}
