package org.monitoring.models.dto;

import jakarta.validation.constraints.Size;

public record MetricUpdateRequest(
        @Size(max = 255) String label,
        @Size(max = 50) String unit,
        String description
) {
}
