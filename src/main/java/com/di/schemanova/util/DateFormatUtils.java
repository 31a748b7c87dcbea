package com.di.schemanova.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Lenient date recognition for text cells. Tries ISO date-time first, then a fixed list of
 * date-only patterns in order; the first pattern that parses wins.
 */
public final class DateFormatUtils {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = Arrays.asList(
            strict("uuuu-MM-dd"),   // ISO standard
            strict("dd/MM/uuuu"),   // UK / EU
            strict("MM-dd-uuuu"),   // US
            strict("uuuu/MM/dd"),   // Logs
            strict("dd-MM-uuuu"),   // Forms
            strict("MM/dd/uuuu"),   // US alternate
            strict("dd.MM.uuuu"),   // Central Europe
            strict("uuuu.MM.dd"),   // Asia / Legacy systems
            strict("uuuuMMdd")
    );

    private DateFormatUtils() {
    }

    /**
     * Parses a text value into a {@link LocalDateTime} (when a time part is present) or a
     * {@link LocalDate}. Returns empty when no known pattern matches.
     */
    public static Optional<Temporal> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        // a date needs at least 6 characters; anything shorter is a number or a code
        if (value.length() < 6) {
            return Optional.empty();
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, f));
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, f));
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        return Optional.empty();
    }

    /** True for values that are already temporal (e.g. a column cleaned once before). */
    public static boolean isTemporal(Object value) {
        return value instanceof LocalDate || value instanceof LocalDateTime;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
