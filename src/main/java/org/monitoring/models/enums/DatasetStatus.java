package org.monitoring.models.enums;

import java.util.EnumSet;
import java.util.Set;

public enum DatasetStatus {
    UPLOADED,
    ANALYZING,
    ANALYZED,
    CONFIRMED,
    INGESTING,
    INGESTED,
    FAILED;

    private static final Set<DatasetStatus> MAPPING_STATES = EnumSet.of(ANALYZED, CONFIRMED, INGESTED);

    /**
     * Whether a dataset in this status carries a column mapping.
     */
    public boolean holdsMapping() {
        return MAPPING_STATES.contains(this);
    }

    public boolean isInFlight() {
        return this == ANALYZING || this == INGESTING;
    }
}
