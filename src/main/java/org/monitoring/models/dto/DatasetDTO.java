package org.monitoring.models.dto;

import org.monitoring.models.entity.Dataset;
import org.monitoring.models.enums.DatasetStatus;
import org.monitoring.models.mapping.ColumnDescriptor;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.utils.ColumnNameNormalizer;

import java.time.Instant;
import java.util.List;

public record DatasetDTO(
        Long id,
        String uid,
        Long projectId,
        String originalFilename,
        String format,
        List<String> headers,
        List<ColumnDescriptor> columns,
        long rowCount,
        DatasetStatus status,
        ColumnMapping mapping,
        String error,
        boolean retryable,
        DatasetStatus failedStage,
        Long revision,
        Instant createdAt,
        Instant updatedAt
) {

    public static DatasetDTO from(Dataset dataset) {
        List<String> headers = dataset.getHeaders() == null ? List.of() : List.copyOf(dataset.getHeaders());
        return new DatasetDTO(
                dataset.getId(),
                dataset.getDatasetUid(),
                dataset.getProjectId() != null ? dataset.getProjectId() : dataset.getProject().getId(),
                dataset.getOriginalFilename(),
                dataset.getFormat(),
                headers,
                ColumnNameNormalizer.describe(headers),
                dataset.getRowCount() == null ? 0 : dataset.getRowCount(),
                dataset.getStatus(),
                dataset.getMapping(),
                dataset.getError(),
                Boolean.TRUE.equals(dataset.getRetryable()),
                dataset.getFailedStage(),
                dataset.getRevision(),
                dataset.getCreatedAt(),
                dataset.getUpdatedAt()
        );
    }
}
