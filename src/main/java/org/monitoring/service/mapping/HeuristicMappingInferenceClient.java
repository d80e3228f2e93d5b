package org.monitoring.service.mapping;

import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.MappingOrigin;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.service.etl.TimestampParser;
import org.monitoring.service.etl.ValueCoercer;
import org.monitoring.utils.ColumnNameNormalizer;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Deterministic proposer: scores normalized header names against role keywords and keeps a
 * candidate only when the sample values agree with the role.
 */
public class HeuristicMappingInferenceClient implements MappingInferenceClient {

    static final double EXACT_MATCH = 0.9;
    static final double TOKEN_MATCH = 0.7;

    private final Map<CanonicalRole, Set<String>> exactNames = new EnumMap<>(CanonicalRole.class);
    private final Map<CanonicalRole, Set<String>> tokens = new EnumMap<>(CanonicalRole.class);
    private final TimestampParser timestampParser;

    public HeuristicMappingInferenceClient(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;

        exactNames.put(CanonicalRole.ENTITY_ID, Set.of("id", "entity_id", "site_id", "station_id", "well_id",
                "object_id", "location_id", "sensor_id", "identifier", "uid"));
        exactNames.put(CanonicalRole.LATITUDE, Set.of("lat", "latitude", "lat_n", "lat_deg", "y_coord"));
        exactNames.put(CanonicalRole.LONGITUDE, Set.of("lon", "lng", "long", "longitude", "long_e", "lon_e", "lng_e",
                "x_coord"));
        exactNames.put(CanonicalRole.TIMESTAMP, Set.of("timestamp", "time", "date", "datetime", "date_time",
                "observed_at", "recorded_at", "measured_at"));
        exactNames.put(CanonicalRole.METRIC_NAME, Set.of("metric", "metric_name", "parameter", "variable",
                "indicator", "measure"));
        exactNames.put(CanonicalRole.METRIC_VALUE, Set.of("value", "metric_value", "reading", "measurement",
                "result", "observation"));

        tokens.put(CanonicalRole.ENTITY_ID, Set.of("id", "code", "station", "site", "well"));
        tokens.put(CanonicalRole.LATITUDE, Set.of("lat", "latitude"));
        tokens.put(CanonicalRole.LONGITUDE, Set.of("lon", "lng", "long", "longitude"));
        tokens.put(CanonicalRole.TIMESTAMP, Set.of("date", "time", "timestamp", "datetime"));
        tokens.put(CanonicalRole.METRIC_NAME, Set.of("metric", "parameter", "indicator"));
        tokens.put(CanonicalRole.METRIC_VALUE, Set.of("value", "reading", "measurement"));
    }

    @Override
    public String name() {
        return "heuristic";
    }

    @Override
    public ColumnMapping propose(List<String> headers, List<Map<String, String>> sampleRows) {
        ColumnMapping mapping = new ColumnMapping();
        mapping.setOrigin(MappingOrigin.INFERRED);
        Set<String> used = new HashSet<>();

        for (CanonicalRole role : CanonicalRole.values()) {
            String bestColumn = null;
            double bestScore = 0.0;
            for (String header : headers) {
                if (used.contains(header)) {
                    continue;
                }
                double score = score(role, header);
                if (score > bestScore && samplesAgree(role, header, sampleRows)) {
                    bestScore = score;
                    bestColumn = header;
                }
            }
            if (bestColumn != null) {
                mapping.assign(role, bestColumn);
                mapping.getConfidence().put(role, bestScore);
                used.add(bestColumn);
            } else {
                mapping.getConfidence().put(role, 0.0);
            }
        }

        for (String header : headers) {
            if (!used.contains(header)) {
                mapping.getClassifications().put(header, classify(header, sampleRows));
            }
        }
        return mapping;
    }

    double score(CanonicalRole role, String header) {
        String slug = ColumnNameNormalizer.slugify(header);
        if (exactNames.get(role).contains(slug)) {
            return EXACT_MATCH;
        }
        List<String> parts = Arrays.asList(slug.split("_"));
        for (String token : tokens.get(role)) {
            if (parts.contains(token)) {
                return TOKEN_MATCH;
            }
        }
        return 0.0;
    }

    private boolean samplesAgree(CanonicalRole role, String header, List<Map<String, String>> sampleRows) {
        return switch (role) {
            case LATITUDE -> allPresent(header, sampleRows, value -> inRange(value, 90.0));
            case LONGITUDE -> allPresent(header, sampleRows, value -> inRange(value, 180.0));
            case TIMESTAMP -> allPresent(header, sampleRows, timestampParser::isParseable);
            case METRIC_VALUE -> allPresent(header, sampleRows, ValueCoercer::isNumeric);
            default -> true;
        };
    }

    private boolean allPresent(String header, List<Map<String, String>> sampleRows, Predicate<String> check) {
        return sampleRows.stream()
                .map(row -> row.get(header))
                .filter(Objects::nonNull)
                .allMatch(check);
    }

    private boolean inRange(String value, double bound) {
        Optional<Double> number = ValueCoercer.parseNumber(value);
        return number.isPresent() && Math.abs(number.get()) <= bound;
    }

    private ColumnClassification classify(String header, List<Map<String, String>> sampleRows) {
        List<String> values = sampleRows.stream()
                .map(row -> row.get(header))
                .filter(Objects::nonNull)
                .toList();
        if (values.isEmpty()) {
            return ColumnClassification.TEXT;
        }
        if (values.stream().allMatch(ValueCoercer::isNumeric)) {
            return ColumnClassification.NUMERICAL;
        }
        long distinct = values.stream().distinct().count();
        if (values.size() >= 2 && distinct <= Math.max(1, values.size() / 2)) {
            return ColumnClassification.CATEGORICAL;
        }
        return ColumnClassification.TEXT;
    }
}
