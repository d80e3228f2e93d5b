package org.monitoring.models.enums;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED
}
