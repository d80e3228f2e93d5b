package org.monitoring.models.enums;

/**
 * Fixed semantic roles a raw column can be assigned to.
 */
public enum CanonicalRole {
    ENTITY_ID,
    LATITUDE,
    LONGITUDE,
    TIMESTAMP,
    METRIC_NAME,
    METRIC_VALUE
}
