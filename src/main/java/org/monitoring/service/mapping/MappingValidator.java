package org.monitoring.service.mapping;

import org.monitoring.exceptions.MappingValidationException;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.models.mapping.MappingViolation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic gate between a proposed mapping and any data mutation.
 *
 * <p>Checks run in order: referenced columns exist, no column is referenced twice, at least one
 * ingestion mode is satisfied, remaining columns are classified and confidences lie in [0,1].
 * A failure at one stage stops the later stages. The input is never modified.
 */
@Component
public class MappingValidator {

    public ColumnMapping validate(ColumnMapping proposed, Collection<String> headers) {
        if (proposed == null) {
            throw new MappingValidationException(List.of(new MappingViolation("mapping", null,
                    MappingViolation.Code.NO_INGESTION_MODE, "A column mapping is required")));
        }
        Set<String> known = new LinkedHashSet<>(headers);
        List<MappingViolation> violations = new ArrayList<>();

        for (CanonicalRole role : CanonicalRole.values()) {
            Optional<String> column = proposed.column(role);
            if (column.isPresent() && !known.contains(column.get())) {
                violations.add(new MappingViolation("roles." + role.name(), column.get(),
                        MappingViolation.Code.UNKNOWN_COLUMN,
                        role.name() + " references unknown column '" + column.get() + "'"));
            }
        }
        if (proposed.getClassifications() != null) {
            for (String column : proposed.getClassifications().keySet()) {
                if (!known.contains(column)) {
                    violations.add(new MappingViolation("classifications", column,
                            MappingViolation.Code.UNKNOWN_COLUMN,
                            "Classification given for unknown column '" + column + "'"));
                }
            }
        }
        failIfAny(violations);

        Map<String, CanonicalRole> firstUse = new HashMap<>();
        for (CanonicalRole role : CanonicalRole.values()) {
            Optional<String> column = proposed.column(role);
            if (column.isEmpty()) {
                continue;
            }
            CanonicalRole previous = firstUse.putIfAbsent(column.get(), role);
            if (previous != null) {
                violations.add(new MappingViolation("roles." + role.name(), column.get(),
                        MappingViolation.Code.DUPLICATE_REFERENCE,
                        "Column '" + column.get() + "' is already mapped to " + previous.name()));
            }
        }
        failIfAny(violations);

        if (proposed.ingestionMode().isEmpty()) {
            violations.add(new MappingViolation("roles", null, MappingViolation.Code.NO_INGESTION_MODE,
                    "Map ENTITY_ID or both LATITUDE and LONGITUDE for entities, "
                            + "or TIMESTAMP and METRIC_VALUE for time series"));
        }
        failIfAny(violations);

        if (proposed.getConfidence() != null) {
            proposed.getConfidence().forEach((role, score) -> {
                if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
                    violations.add(new MappingViolation("confidence." + role.name(), null,
                            MappingViolation.Code.INVALID_CONFIDENCE,
                            "Confidence for " + role.name() + " must lie in [0,1], got " + score));
                }
            });
        }
        failIfAny(violations);

        return normalise(proposed, known);
    }

    private ColumnMapping normalise(ColumnMapping proposed, Set<String> headers) {
        ColumnMapping confirmed = proposed.copy();
        confirmed.getRoles().clear();
        for (CanonicalRole role : CanonicalRole.values()) {
            proposed.column(role).ifPresent(column -> confirmed.assign(role, column));
        }
        confirmed.getConfidence().values().removeIf(score -> score == null);

        Set<String> referenced = confirmed.referencedColumns();
        Map<String, ColumnClassification> given = proposed.getClassifications() == null
                ? Map.of() : proposed.getClassifications();
        Map<String, ColumnClassification> classifications = new LinkedHashMap<>();
        for (String header : headers) {
            if (!referenced.contains(header)) {
                ColumnClassification classification = given.get(header);
                classifications.put(header, classification != null ? classification : ColumnClassification.TEXT);
            }
        }
        confirmed.setClassifications(classifications);
        return confirmed;
    }

    private void failIfAny(List<MappingViolation> violations) {
        if (!violations.isEmpty()) {
            throw new MappingValidationException(violations);
        }
    }
}
