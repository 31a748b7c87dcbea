package com.di.schemanova.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DateFormatUtils utility class.
 */
@DisplayName("DateFormatUtils Tests")
class DateFormatUtilsTest {

    // ============================================================================
    // tryParse Tests
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "2024-01-15, 2024-01-15",
        "15/01/2024, 2024-01-15",
        "01-15-2024, 2024-01-15",
        "2024/01/15, 2024-01-15",
        "15-01-2024, 2024-01-15",
        "01/15/2024, 2024-01-15",
        "15.01.2024, 2024-01-15",
        "2024.01.15, 2024-01-15",
        "20240115, 2024-01-15"
    })
    @DisplayName("Should parse every supported date-only format")
    void testTryParse_DateFormats(String input, String expected) {
        assertEquals(LocalDate.parse(expected), DateFormatUtils.tryParse(input).orElseThrow());
    }

    @ParameterizedTest
    @CsvSource({
        "2024-03-01T10:30:00, 2024-03-01T10:30:00",
        "2024-03-01 10:30:00, 2024-03-01T10:30:00",
        "2024-03-01 10:30, 2024-03-01T10:30:00"
    })
    @DisplayName("Should parse date-time values as LocalDateTime")
    void testTryParse_DateTimeFormats(String input, String expected) {
        assertEquals(LocalDateTime.parse(expected), DateFormatUtils.tryParse(input).orElseThrow());
    }

    @Test
    @DisplayName("Day-first should win when both readings are valid")
    void testTryParse_AmbiguousDayMonth() {
        assertEquals(LocalDate.of(2024, 2, 3), DateFormatUtils.tryParse("03/02/2024").orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "12345", "soon", "2024-02-30", "31/31/2024", "2024-13-01"})
    @DisplayName("Should return empty for short, invalid or impossible dates")
    void testTryParse_Invalid(String input) {
        assertTrue(DateFormatUtils.tryParse(input).isEmpty());
    }

    @Test
    @DisplayName("Should return empty for null")
    void testTryParse_Null() {
        assertTrue(DateFormatUtils.tryParse(null).isEmpty());
    }

    // ============================================================================
    // isTemporal Tests
    // ============================================================================

    @Test
    @DisplayName("Should recognize already-parsed temporal values only")
    void testIsTemporal() {
        assertTrue(DateFormatUtils.isTemporal(LocalDate.of(2024, 1, 1)));
        assertTrue(DateFormatUtils.isTemporal(LocalDateTime.of(2024, 1, 1, 0, 0)));
        assertFalse(DateFormatUtils.isTemporal("2024-01-01"));
        assertFalse(DateFormatUtils.isTemporal(null));
    }
}
