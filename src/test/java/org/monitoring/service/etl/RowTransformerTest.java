package org.monitoring.service.etl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.enums.RejectionCode;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.service.ingestion.RawRow;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RowTransformer.
 */
@DisplayName("RowTransformer Tests")
class RowTransformerTest {

    private static final List<String> WELL_HEADERS = List.of("Well_ID", "Lat_N", "Long_E", "Depth_M", "Status");

    private final TimestampParser timestampParser = new TimestampParser(new MonitoringProperties());

    private static RawRow row(long rowNumber, List<String> headers, String... cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int idx = 0; idx < headers.size(); idx++) {
            values.put(headers.get(idx), idx < cells.length ? cells[idx] : null);
        }
        return new RawRow(rowNumber, values);
    }

    private static ColumnMapping wellMapping() {
        return new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "Well_ID")
                .assign(CanonicalRole.LATITUDE, "Lat_N")
                .assign(CanonicalRole.LONGITUDE, "Long_E");
    }

    @Test
    @DisplayName("Should build a well entity with typed extras")
    void testTransform_WellEntity() {
        RowTransformer transformer = new RowTransformer(wellMapping(), WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(1, WELL_HEADERS, "W1", "12.9", "77.5", "10", "active"));

        assertEquals(IngestionMode.ENTITY_ONLY, transformer.mode());
        assertFalse(outcome.rejected());
        assertNull(outcome.reading());
        RowOutcome.EntityDraft entity = outcome.entity();
        assertEquals("W1", entity.externalId());
        assertEquals(12.9, entity.latitude());
        assertEquals(77.5, entity.longitude());
        assertEquals(Map.of("Depth_M", 10L, "Status", "active"), entity.extra());
    }

    @Test
    @DisplayName("Should keep the entity and reject the row when a numeric column is mapped as timestamp")
    void testTransform_MisassignedTimestamp() {
        ColumnMapping mapping = wellMapping().assign(CanonicalRole.TIMESTAMP, "Depth_M");
        RowTransformer transformer = new RowTransformer(mapping, WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(1, WELL_HEADERS, "W1", "12.9", "77.5", "10", "active"));

        assertEquals(IngestionMode.ENTITY_ONLY, transformer.mode());
        assertTrue(outcome.rejected());
        assertEquals(RejectionCode.INVALID_TIMESTAMP, outcome.rejection().code());
        assertEquals(List.of("Depth_M"), outcome.rejection().columns());
        assertNull(outcome.reading());
        assertNotNull(outcome.entity());
        assertEquals("10", String.valueOf(outcome.entity().extra().get("Depth_M")));
    }

    @Test
    @DisplayName("Should reject the whole row on an out-of-range coordinate")
    void testTransform_CoordinateOutOfRange() {
        RowTransformer transformer = new RowTransformer(wellMapping(), WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(4, WELL_HEADERS, "W1", "95.0", "77.5", "10", "active"));

        assertTrue(outcome.rejected());
        assertNull(outcome.entity());
        assertEquals(4, outcome.rejection().rowNumber());
        assertEquals(RejectionCode.COORDINATE_OUT_OF_RANGE, outcome.rejection().code());
        assertEquals(List.of("Lat_N"), outcome.rejection().columns());
    }

    @Test
    @DisplayName("Should reject a non-numeric coordinate")
    void testTransform_InvalidCoordinate() {
        RowTransformer transformer = new RowTransformer(wellMapping(), WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(2, WELL_HEADERS, "W1", "12.9", "east", "10", "active"));

        assertEquals(RejectionCode.INVALID_COORDINATE, outcome.rejection().code());
        assertNull(outcome.entity());
    }

    @Test
    @DisplayName("Should synthesize a stable identity from coordinates when the id cell is blank")
    void testTransform_SynthesizedIdentity() {
        RowTransformer transformer = new RowTransformer(wellMapping(), WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome first = transformer.transform(row(1, WELL_HEADERS, null, "12.9", "77.5", "10", "active"));
        RowOutcome second = transformer.transform(row(2, WELL_HEADERS, null, "12.90", "77.500", "11", "idle"));

        String expected = RowTransformer.synthesizeId(12.9, 77.5);
        assertTrue(expected.matches("loc-[0-9a-f]{16}"));
        assertEquals(expected, first.entity().externalId());
        assertEquals(expected, second.entity().externalId());
    }

    @Test
    @DisplayName("Should reject a row with neither id nor complete coordinates")
    void testTransform_MissingIdentity() {
        RowTransformer transformer = new RowTransformer(wellMapping(), WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(3, WELL_HEADERS, null, "12.9", null, "10", "active"));

        assertEquals(RejectionCode.MISSING_IDENTITY, outcome.rejection().code());
        assertEquals(List.of("Well_ID", "Lat_N", "Long_E"), outcome.rejection().columns());
    }

    @Test
    @DisplayName("Should produce a reading per row for a combined mapping")
    void testTransform_BothMode() {
        List<String> headers = List.of("site", "ts", "param", "val", "note");
        ColumnMapping mapping = new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "site")
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_NAME, "param")
                .assign(CanonicalRole.METRIC_VALUE, "val");
        RowTransformer transformer = new RowTransformer(mapping, headers, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(1, headers, "S1", "2024-01-15T10:00:00Z", "pH", "7.2", "clear"));

        assertEquals(IngestionMode.BOTH, transformer.mode());
        RowOutcome.ReadingDraft reading = outcome.reading();
        assertEquals("S1", reading.externalId());
        assertEquals("pH", reading.metricName());
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), reading.observedAt());
        assertEquals(7.2, reading.value());
        assertEquals(Map.of("note", "clear"), reading.extra());
    }

    @Test
    @DisplayName("Should use the value column name as metric when no name role or default is given")
    void testTransform_MetricNameFallback() {
        List<String> headers = List.of("ts", "temperature");
        ColumnMapping mapping = new ColumnMapping()
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_VALUE, "temperature");
        RowTransformer transformer = new RowTransformer(mapping, headers, timestampParser, "dataset-abc");

        RowOutcome outcome = transformer.transform(row(1, headers, "2024-01-15", "21.5"));

        assertEquals(IngestionMode.TIME_SERIES, transformer.mode());
        assertEquals("temperature", outcome.reading().metricName());
        assertEquals("dataset-abc", outcome.reading().externalId());
        assertEquals("dataset-abc", outcome.entity().externalId());
        assertTrue(outcome.entity().extra().isEmpty());
    }

    @Test
    @DisplayName("Should prefer the configured default metric name")
    void testTransform_DefaultMetricName() {
        List<String> headers = List.of("site", "ts", "val");
        ColumnMapping mapping = new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "site")
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_VALUE, "val");
        mapping.setDefaultMetricName(" Water Level ");
        RowTransformer transformer = new RowTransformer(mapping, headers, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(1, headers, "S1", "2024-01-15", "3.4"));

        assertEquals("Water Level", outcome.reading().metricName());
    }

    @Test
    @DisplayName("Should collect every reading problem into one rejection")
    void testTransform_MultipleProblems() {
        List<String> headers = List.of("site", "ts", "param", "val");
        ColumnMapping mapping = new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "site")
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_NAME, "param")
                .assign(CanonicalRole.METRIC_VALUE, "val");
        RowTransformer transformer = new RowTransformer(mapping, headers, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(9, headers, "S1", "not-a-date", null, "n/a"));

        assertNull(outcome.reading());
        assertNotNull(outcome.entity());
        assertEquals(RejectionCode.INVALID_TIMESTAMP, outcome.rejection().code());
        assertEquals(List.of("ts", "val", "param"), outcome.rejection().columns());
        assertEquals(3, outcome.rejection().message().split("; ").length);
    }

    @Test
    @DisplayName("Should leave IGNORED columns out of extras")
    void testTransform_IgnoredColumn() {
        ColumnMapping mapping = wellMapping();
        mapping.getClassifications().put("Status", ColumnClassification.IGNORED);
        RowTransformer transformer = new RowTransformer(mapping, WELL_HEADERS, timestampParser, "dataset-x");

        RowOutcome outcome = transformer.transform(row(1, WELL_HEADERS, "W1", "12.9", "77.5", "007", "active"));

        assertEquals(Map.of("Depth_M", "007"), outcome.entity().extra());
    }
}
