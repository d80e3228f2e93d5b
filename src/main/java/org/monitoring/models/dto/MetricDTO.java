package org.monitoring.models.dto;

import org.monitoring.models.entity.MetricCatalog;

import java.time.Instant;

public record MetricDTO(
        String key,
        String label,
        String unit,
        String description,
        boolean isCore,
        Instant createdAt
) {

    public static MetricDTO from(MetricCatalog metric) {
        return new MetricDTO(
                metric.getMetricKey(),
                metric.getLabel(),
                metric.getUnit(),
                metric.getDescription(),
                Boolean.TRUE.equals(metric.getIsCore()),
                metric.getCreatedAt()
        );
    }
}
