package org.monitoring.models.enums;

public enum ColumnClassification {
    CATEGORICAL,
    NUMERICAL,
    TEXT,
    IGNORED
}
