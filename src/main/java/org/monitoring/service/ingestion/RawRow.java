package org.monitoring.service.ingestion;

import java.util.Map;

/**
 * One data row keyed by header. {@code rowNumber} counts data rows from 1, the header excluded.
 * Blank cells are held as {@code null}.
 */
public record RawRow(long rowNumber, Map<String, String> values) {

    public String get(String column) {
        return column == null ? null : values.get(column);
    }
}
