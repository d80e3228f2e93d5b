package org.monitoring.models.mapping;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.enums.MappingOrigin;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assignment of raw columns to canonical roles plus the classification of every other column.
 * Persisted as a JSON document on the dataset and on each ingestion run.
 */
@Data
@NoArgsConstructor
public class ColumnMapping implements Serializable {

    private Map<CanonicalRole, String> roles = new EnumMap<>(CanonicalRole.class);

    private Map<String, ColumnClassification> classifications = new LinkedHashMap<>();

    private Map<CanonicalRole, Double> confidence = new EnumMap<>(CanonicalRole.class);

    private String defaultMetricName;

    private String metricUnit;

    private MappingOrigin origin = MappingOrigin.USER;

    public static ColumnMapping fallback(List<String> headers) {
        ColumnMapping mapping = new ColumnMapping();
        mapping.setOrigin(MappingOrigin.FALLBACK);
        for (String header : headers) {
            mapping.getClassifications().put(header, ColumnClassification.TEXT);
        }
        for (CanonicalRole role : CanonicalRole.values()) {
            mapping.getConfidence().put(role, 0.0);
        }
        return mapping;
    }

    public ColumnMapping copy() {
        ColumnMapping copy = new ColumnMapping();
        if (roles != null) {
            copy.getRoles().putAll(roles);
        }
        if (classifications != null) {
            copy.getClassifications().putAll(classifications);
        }
        if (confidence != null) {
            copy.getConfidence().putAll(confidence);
        }
        copy.setDefaultMetricName(defaultMetricName);
        copy.setMetricUnit(metricUnit);
        copy.setOrigin(origin);
        return copy;
    }

    public ColumnMapping assign(CanonicalRole role, String column) {
        roles.put(role, column);
        return this;
    }

    public Optional<String> column(CanonicalRole role) {
        if (roles == null) {
            return Optional.empty();
        }
        String column = roles.get(role);
        return column == null || column.isBlank() ? Optional.empty() : Optional.of(column);
    }

    public boolean maps(CanonicalRole role) {
        return column(role).isPresent();
    }

    public Set<String> referencedColumns() {
        Set<String> referenced = new LinkedHashSet<>();
        for (CanonicalRole role : CanonicalRole.values()) {
            column(role).ifPresent(referenced::add);
        }
        return referenced;
    }

    public boolean supportsEntities() {
        return maps(CanonicalRole.ENTITY_ID)
                || (maps(CanonicalRole.LATITUDE) && maps(CanonicalRole.LONGITUDE));
    }

    public boolean supportsTimeSeries() {
        return maps(CanonicalRole.TIMESTAMP) && maps(CanonicalRole.METRIC_VALUE);
    }

    /**
     * Ingestion mode implied by the populated roles, empty when neither combination holds.
     */
    public Optional<IngestionMode> ingestionMode() {
        boolean entities = supportsEntities();
        boolean series = supportsTimeSeries();
        if (entities && series) {
            return Optional.of(IngestionMode.BOTH);
        }
        if (series) {
            return Optional.of(IngestionMode.TIME_SERIES);
        }
        if (entities) {
            return Optional.of(IngestionMode.ENTITY_ONLY);
        }
        return Optional.empty();
    }

    public ColumnClassification classificationOf(String column) {
        if (classifications == null) {
            return ColumnClassification.TEXT;
        }
        return classifications.getOrDefault(column, ColumnClassification.TEXT);
    }
}
