package org.monitoring.exceptions;

import org.monitoring.models.mapping.MappingViolation;

import java.util.List;
import java.util.stream.Collectors;

public class MappingValidationException extends RuntimeException {

    private final List<MappingViolation> violations;

    public MappingValidationException(List<MappingViolation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<MappingViolation> getViolations() {
        return violations;
    }

    private static String describe(List<MappingViolation> violations) {
        return "Column mapping rejected: " + violations.stream()
                .map(MappingViolation::message)
                .collect(Collectors.joining("; "));
    }
}
