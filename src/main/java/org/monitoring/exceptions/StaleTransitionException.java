package org.monitoring.exceptions;

import org.monitoring.models.enums.DatasetStatus;

/**
 * A lifecycle transition lost against the dataset's current status or revision.
 * Callers re-read the dataset and decide again.
 */
public class StaleTransitionException extends RuntimeException {

    private final Long datasetId;
    private final DatasetStatus currentStatus;
    private final Long currentRevision;

    public StaleTransitionException(Long datasetId, DatasetStatus currentStatus, Long currentRevision, String message) {
        super(message);
        this.datasetId = datasetId;
        this.currentStatus = currentStatus;
        this.currentRevision = currentRevision;
    }

    public Long getDatasetId() {
        return datasetId;
    }

    public DatasetStatus getCurrentStatus() {
        return currentStatus;
    }

    public Long getCurrentRevision() {
        return currentRevision;
    }
}
