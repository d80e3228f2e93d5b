package org.monitoring.service.etl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ValueCoercer.
 */
@DisplayName("ValueCoercer Tests")
class ValueCoercerTest {

    @Test
    @DisplayName("Should coerce canonical integers to Long")
    void testCoerce_Integer() {
        assertEquals(10L, ValueCoercer.coerce("10"));
        assertEquals(-3L, ValueCoercer.coerce("-3"));
        assertEquals(0L, ValueCoercer.coerce("0"));
    }

    @Test
    @DisplayName("Should coerce canonical decimals to Double")
    void testCoerce_Decimal() {
        assertEquals(12.9, ValueCoercer.coerce("12.9"));
        assertEquals(1.5e3, ValueCoercer.coerce("1.5e3"));
    }

    @ParameterizedTest
    @DisplayName("Should keep non-canonical values as strings")
    @ValueSource(strings = {"007", "active", "1,5", "+4", "12.", "0x1F", "NaN", "99999999999999999999"})
    void testCoerce_KeepsString(String raw) {
        assertEquals(raw, ValueCoercer.coerce(raw));
    }

    @Test
    @DisplayName("Should return null for null input")
    void testCoerce_Null() {
        assertNull(ValueCoercer.coerce(null));
    }

    @ParameterizedTest
    @DisplayName("Should parse lenient numbers")
    @CsvSource({
            "12.9, 12.9",
            "+4, 4.0",
            "' -77.5 ', -77.5",
            ".5, 0.5",
            "3., 3.0",
            "2E2, 200.0"
    })
    void testParseNumber(String raw, double expected) {
        Optional<Double> parsed = ValueCoercer.parseNumber(raw);
        assertTrue(parsed.isPresent());
        assertEquals(expected, parsed.get(), 1e-9);
    }

    @ParameterizedTest
    @DisplayName("Should reject non-numeric or non-finite input")
    @ValueSource(strings = {"abc", "NaN", "Infinity", "1e999", "0x10", "1d", "1f", "", "1 2"})
    void testParseNumber_Rejects(String raw) {
        assertFalse(ValueCoercer.isNumeric(raw));
    }
}
