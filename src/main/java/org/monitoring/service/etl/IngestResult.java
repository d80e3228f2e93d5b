package org.monitoring.service.etl;

import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.mapping.RowRejection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful ingestion.
 *
 * @param rowsRejected rows that contributed nothing to the mode's primary output
 * @param errorCount   rows with at least one problem, including rows whose entity was still written
 * @param summary      {@code "N additional rows rejected"} when the rejection list was capped, else null
 */
public record IngestResult(
        IngestionMode mode,
        long rowsRead,
        long rowsRejected,
        long errorCount,
        long entitiesWritten,
        long readingsWritten,
        List<RowRejection> rejections,
        String summary
) {

    public Map<String, Object> toReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("mode", mode.name());
        report.put("errorCount", errorCount);
        report.put("rejections", rejectionsAsMaps(rejections));
        if (summary != null) {
            report.put("summary", summary);
        }
        return report;
    }

    public static List<Map<String, Object>> rejectionsAsMaps(List<RowRejection> rejections) {
        return rejections.stream().map(rejection -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("row", rejection.rowNumber());
            entry.put("code", rejection.code().name());
            entry.put("columns", rejection.columns());
            entry.put("message", rejection.message());
            return entry;
        }).toList();
    }
}
