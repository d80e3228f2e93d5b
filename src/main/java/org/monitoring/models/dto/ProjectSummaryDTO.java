package org.monitoring.models.dto;

public record ProjectSummaryDTO(
        ProjectDTO project,
        long objects,
        long readings,
        long metrics
) {
}
