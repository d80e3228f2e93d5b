package org.monitoring.exceptions;

import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.mapping.RowRejection;

import java.util.List;

/**
 * Raised when a whole dataset cannot be ingested. Individual bad rows never raise this.
 */
public class IngestException extends RuntimeException {

    private final IngestErrorCode code;
    private final List<RowRejection> rejections;

    public IngestException(IngestErrorCode code, String message) {
        this(code, message, null, List.of());
    }

    public IngestException(IngestErrorCode code, String message, Throwable cause) {
        this(code, message, cause, List.of());
    }

    public IngestException(IngestErrorCode code, String message, Throwable cause, List<RowRejection> rejections) {
        super(message, cause);
        this.code = code;
        this.rejections = List.copyOf(rejections);
    }

    public IngestErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    /**
     * Row rejections gathered before the failure, when the failure is a rejection-threshold breach.
     */
    public List<RowRejection> getRejections() {
        return rejections;
    }
}
