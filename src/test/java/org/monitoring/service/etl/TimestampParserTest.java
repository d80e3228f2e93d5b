package org.monitoring.service.etl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.monitoring.configuration.MonitoringProperties;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for TimestampParser.
 */
@DisplayName("TimestampParser Tests")
class TimestampParserTest {

    private final TimestampParser parser = new TimestampParser(new MonitoringProperties());

    @ParameterizedTest
    @DisplayName("Should parse the default formats as UTC instants")
    @CsvSource({
            "2024-01-15T10:30:00Z, 2024-01-15T10:30:00Z",
            "2024-01-15T10:30:00+02:00, 2024-01-15T08:30:00Z",
            "2024-01-15T10:30:00, 2024-01-15T10:30:00Z",
            "2024-01-15, 2024-01-15T00:00:00Z",
            "2024-01-15 10:30:00, 2024-01-15T10:30:00Z",
            "2024/01/15 10:30:00, 2024-01-15T10:30:00Z",
            "15/01/2024 10:30, 2024-01-15T10:30:00Z",
            "15.01.2024, 2024-01-15T00:00:00Z"
    })
    void testParse_DefaultFormats(String raw, String expected) {
        assertEquals(Instant.parse(expected), parser.parse(raw).orElseThrow());
    }

    @Test
    @DisplayName("Should read epoch seconds and epoch milliseconds")
    void testParse_Epoch() {
        assertEquals(Instant.ofEpochSecond(1705314600L), parser.parse("1705314600").orElseThrow());
        assertEquals(Instant.ofEpochMilli(1705314600123L), parser.parse("1705314600123").orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Should reject values matching no accepted format")
    @ValueSource(strings = {"10", "12.5", "active", "2024-13-45", "yesterday", "  "})
    void testParse_Rejects(String raw) {
        assertTrue(parser.parse(raw).isEmpty());
        assertFalse(parser.isParseable(raw));
    }

    @Test
    @DisplayName("Should return empty for null input")
    void testParse_Null() {
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Should apply the configured zone to local values")
    void testParse_ConfiguredZone() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getIngestion().setZone("Asia/Kolkata");
        TimestampParser kolkata = new TimestampParser(properties);

        assertEquals(Instant.parse("2024-01-15T05:00:00Z"), kolkata.parse("2024-01-15 10:30:00").orElseThrow());
    }

    @Test
    @DisplayName("Should honour a restricted format list and disabled epoch parsing")
    void testParse_CustomFormats() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getIngestion().setTimestampFormats(List.of("MM/dd/yyyy"));
        properties.getIngestion().setAcceptEpoch(false);
        TimestampParser custom = new TimestampParser(properties);

        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), custom.parse("01/15/2024").orElseThrow());
        assertTrue(custom.parse("2024-01-15").isEmpty());
        assertTrue(custom.parse("1705314600").isEmpty());
    }
}
