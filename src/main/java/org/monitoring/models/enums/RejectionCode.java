package org.monitoring.models.enums;

public enum RejectionCode {
    MISSING_IDENTITY,
    INVALID_IDENTITY,
    INVALID_COORDINATE,
    COORDINATE_OUT_OF_RANGE,
    INVALID_TIMESTAMP,
    INVALID_METRIC_VALUE,
    MISSING_METRIC_NAME
}
