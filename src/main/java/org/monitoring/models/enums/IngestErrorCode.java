package org.monitoring.models.enums;

public enum IngestErrorCode {
    MAPPING_DRIFT(true),
    STORAGE_UNAVAILABLE(true),
    REJECTION_THRESHOLD_EXCEEDED(true),
    CANCELLED(true),
    MALFORMED_SOURCE(false);

    private final boolean retryable;

    IngestErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
