package org.monitoring.service.etl;

import org.monitoring.models.entity.UnifiedObject;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.enums.RejectionCode;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.models.mapping.RowRejection;
import org.monitoring.service.ingestion.RawRow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns one raw row into entity and reading drafts for a confirmed mapping.
 *
 * <p>Stateless after construction and safe to call from several threads.
 */
public class RowTransformer {

    private static final Set<CanonicalRole> READING_ROLES =
            EnumSet.of(CanonicalRole.TIMESTAMP, CanonicalRole.METRIC_NAME, CanonicalRole.METRIC_VALUE);

    private final ColumnMapping mapping;
    private final IngestionMode mode;
    private final TimestampParser timestampParser;
    private final List<String> extraColumns;
    private final List<String> preservedRoleColumns;
    private final String fixedMetricName;
    private final String datasetScopedId;

    /**
     * @param datasetScopedId identity used for every row when the mapping has no identity roles at all
     */
    public RowTransformer(ColumnMapping mapping, List<String> headers, TimestampParser timestampParser,
                          String datasetScopedId) {
        this.mapping = mapping;
        this.mode = mapping.ingestionMode()
                .orElseThrow(() -> new IllegalArgumentException("Mapping supports no ingestion mode"));
        this.timestampParser = timestampParser;
        this.datasetScopedId = datasetScopedId;

        Set<String> referenced = mapping.referencedColumns();
        this.extraColumns = headers.stream()
                .filter(header -> !referenced.contains(header))
                .filter(header -> mapping.classificationOf(header) != ColumnClassification.IGNORED)
                .toList();

        // reading roles write nowhere in entity-only mode, so their cells stay with the entity
        List<String> preserved = new ArrayList<>();
        if (!mode.writesReadings()) {
            for (CanonicalRole role : READING_ROLES) {
                mapping.column(role).ifPresent(preserved::add);
            }
        }
        this.preservedRoleColumns = Collections.unmodifiableList(preserved);

        if (mapping.maps(CanonicalRole.METRIC_NAME)) {
            this.fixedMetricName = null;
        } else if (mapping.getDefaultMetricName() != null && !mapping.getDefaultMetricName().isBlank()) {
            this.fixedMetricName = mapping.getDefaultMetricName().trim();
        } else {
            this.fixedMetricName = mapping.column(CanonicalRole.METRIC_VALUE).orElse(null);
        }
    }

    public IngestionMode mode() {
        return mode;
    }

    public RowOutcome transform(RawRow row) {
        List<Problem> problems = new ArrayList<>();

        Double latitude = coordinate(row, CanonicalRole.LATITUDE, 90.0, problems);
        Double longitude = coordinate(row, CanonicalRole.LONGITUDE, 180.0, problems);
        if (!problems.isEmpty()) {
            return new RowOutcome(row.rowNumber(), null, null, reject(row.rowNumber(), problems));
        }

        boolean datasetScoped = false;
        String externalId = mapping.column(CanonicalRole.ENTITY_ID).map(row::get).orElse(null);
        if (externalId == null) {
            if (latitude != null && longitude != null) {
                externalId = synthesizeId(latitude, longitude);
            } else if (!mapping.supportsEntities() && datasetScopedId != null) {
                externalId = datasetScopedId;
                datasetScoped = true;
            } else {
                problems.add(new Problem(RejectionCode.MISSING_IDENTITY, identityColumns(),
                        "no entity identifier and no complete coordinate pair"));
                return new RowOutcome(row.rowNumber(), null, null, reject(row.rowNumber(), problems));
            }
        } else if (externalId.length() > UnifiedObject.EXTERNAL_ID_LENGTH) {
            problems.add(new Problem(RejectionCode.INVALID_IDENTITY, List.of(mapping.column(CanonicalRole.ENTITY_ID).get()),
                    "entity identifier is longer than " + UnifiedObject.EXTERNAL_ID_LENGTH + " characters"));
            return new RowOutcome(row.rowNumber(), null, null, reject(row.rowNumber(), problems));
        }

        Map<String, Object> extra = extras(row);

        ReadingParts parts = readingParts(row, problems);
        RowOutcome.ReadingDraft reading = null;
        if (mode.writesReadings() && parts.complete()) {
            reading = new RowOutcome.ReadingDraft(externalId, parts.metricName(), parts.observedAt(), parts.value(), extra);
        }

        Map<String, Object> entityExtra;
        if (datasetScoped) {
            entityExtra = Map.of();
        } else if (preservedRoleColumns.isEmpty()) {
            entityExtra = extra;
        } else {
            entityExtra = new LinkedHashMap<>(extra);
            for (String column : preservedRoleColumns) {
                Object value = ValueCoercer.coerce(row.get(column));
                if (value != null) {
                    entityExtra.put(column, value);
                }
            }
        }
        RowOutcome.EntityDraft entity = new RowOutcome.EntityDraft(externalId, latitude, longitude, entityExtra);

        RowRejection rejection = problems.isEmpty() ? null : reject(row.rowNumber(), problems);
        return new RowOutcome(row.rowNumber(), entity, reading, rejection);
    }

    /**
     * {@code loc-} plus the first 16 hex characters of SHA-256 over the coordinates at six decimals.
     */
    public static String synthesizeId(double latitude, double longitude) {
        String key = String.format(Locale.ROOT, "%.6f,%.6f", latitude, longitude);
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return "loc-" + HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest algorithm not available", e);
        }
    }

    private Double coordinate(RawRow row, CanonicalRole role, double bound, List<Problem> problems) {
        Optional<String> column = mapping.column(role);
        if (column.isEmpty()) {
            return null;
        }
        String raw = row.get(column.get());
        if (raw == null) {
            return null;
        }
        Optional<Double> value = ValueCoercer.parseNumber(raw);
        if (value.isEmpty()) {
            problems.add(new Problem(RejectionCode.INVALID_COORDINATE, List.of(column.get()),
                    role.name().toLowerCase(Locale.ROOT) + " '" + raw + "' is not numeric"));
            return null;
        }
        if (Math.abs(value.get()) > bound) {
            problems.add(new Problem(RejectionCode.COORDINATE_OUT_OF_RANGE, List.of(column.get()),
                    role.name().toLowerCase(Locale.ROOT) + " " + raw + " is outside [-" + (int) bound + "," + (int) bound + "]"));
            return null;
        }
        return value.get();
    }

    private ReadingParts readingParts(RawRow row, List<Problem> problems) {
        boolean complete = true;

        Instant observedAt = null;
        Optional<String> timestampColumn = mapping.column(CanonicalRole.TIMESTAMP);
        if (timestampColumn.isPresent()) {
            String raw = row.get(timestampColumn.get());
            observedAt = timestampParser.parse(raw).orElse(null);
            if (observedAt == null) {
                complete = false;
                problems.add(new Problem(RejectionCode.INVALID_TIMESTAMP, List.of(timestampColumn.get()),
                        raw == null ? "timestamp is missing" : "timestamp '" + raw + "' matches no accepted format"));
            }
        }

        Double value = null;
        Optional<String> valueColumn = mapping.column(CanonicalRole.METRIC_VALUE);
        if (valueColumn.isPresent()) {
            String raw = row.get(valueColumn.get());
            value = ValueCoercer.parseNumber(raw).orElse(null);
            if (value == null) {
                complete = false;
                problems.add(new Problem(RejectionCode.INVALID_METRIC_VALUE, List.of(valueColumn.get()),
                        raw == null ? "metric value is missing" : "metric value '" + raw + "' is not numeric"));
            }
        }

        String metricName = fixedMetricName;
        Optional<String> nameColumn = mapping.column(CanonicalRole.METRIC_NAME);
        if (nameColumn.isPresent()) {
            metricName = row.get(nameColumn.get());
            if (metricName == null) {
                complete = false;
                problems.add(new Problem(RejectionCode.MISSING_METRIC_NAME, List.of(nameColumn.get()),
                        "metric name is missing"));
            }
        }

        complete = complete && observedAt != null && value != null && metricName != null;
        return new ReadingParts(complete, metricName, observedAt, value == null ? 0.0 : value);
    }

    private Map<String, Object> extras(RawRow row) {
        Map<String, Object> extra = new LinkedHashMap<>();
        for (String column : extraColumns) {
            Object value = ValueCoercer.coerce(row.get(column));
            if (value != null) {
                extra.put(column, value);
            }
        }
        return extra;
    }

    private List<String> identityColumns() {
        List<String> columns = new ArrayList<>();
        mapping.column(CanonicalRole.ENTITY_ID).ifPresent(columns::add);
        mapping.column(CanonicalRole.LATITUDE).ifPresent(columns::add);
        mapping.column(CanonicalRole.LONGITUDE).ifPresent(columns::add);
        return columns;
    }

    private RowRejection reject(long rowNumber, List<Problem> problems) {
        List<String> columns = problems.stream()
                .flatMap(problem -> problem.columns().stream())
                .distinct()
                .toList();
        String message = problems.stream().map(Problem::message).collect(Collectors.joining("; "));
        return new RowRejection(rowNumber, problems.get(0).code(), columns, message);
    }

    private record Problem(RejectionCode code, List<String> columns, String message) {
    }

    private record ReadingParts(boolean complete, String metricName, Instant observedAt, double value) {
    }
}
