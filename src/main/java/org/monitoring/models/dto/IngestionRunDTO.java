package org.monitoring.models.dto;

import org.monitoring.models.entity.IngestionRun;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.RunStatus;
import org.monitoring.models.mapping.ColumnMapping;

import java.time.Instant;
import java.util.Map;

public record IngestionRunDTO(
        String id,
        RunStatus status, // RUNNING, SUCCESS, FAILED, CANCELLED
        ColumnMapping mappingSnapshot,
        long rowsRead,
        long rowsRejected,
        long entitiesWritten,
        long readingsWritten,
        Map<String, Object> report,
        IngestErrorCode errorCode,
        String errorMessage,
        Instant startedAt,
        Instant endedAt
) {

    public static IngestionRunDTO from(IngestionRun run) {
        return new IngestionRunDTO(
                run.getIngestionUid(),
                run.getRunStatus(),
                run.getMappingSnapshot(),
                zeroIfNull(run.getRowsRead()),
                zeroIfNull(run.getRowsRejected()),
                zeroIfNull(run.getEntitiesWritten()),
                zeroIfNull(run.getReadingsWritten()),
                run.getReport(),
                run.getErrorCode(),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getEndedAt()
        );
    }

    private static long zeroIfNull(Long value) {
        return value == null ? 0L : value;
    }
}
