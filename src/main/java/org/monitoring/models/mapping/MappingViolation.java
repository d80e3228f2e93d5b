package org.monitoring.models.mapping;

public record MappingViolation(
        String field,
        String column,
        Code code,
        String message
) {

    public enum Code {
        UNKNOWN_COLUMN,
        DUPLICATE_REFERENCE,
        NO_INGESTION_MODE,
        INVALID_CONFIDENCE
    }
}
