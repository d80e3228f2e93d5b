package org.monitoring.models.enums;

public enum MappingOrigin {
    INFERRED,
    FALLBACK,
    USER
}
