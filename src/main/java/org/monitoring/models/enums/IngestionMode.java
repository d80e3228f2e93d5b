package org.monitoring.models.enums;

public enum IngestionMode {
    ENTITY_ONLY,
    TIME_SERIES,
    BOTH;

    public boolean writesReadings() {
        return this != ENTITY_ONLY;
    }
}
