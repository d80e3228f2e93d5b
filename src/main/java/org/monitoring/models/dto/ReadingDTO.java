package org.monitoring.models.dto;

import org.monitoring.models.entity.UnifiedTimeSeries;

import java.time.Instant;
import java.util.Map;

public record ReadingDTO(
        String externalId,
        String metric,
        Instant observedAt,
        Double value,
        Map<String, Object> extra
) {

    public static ReadingDTO from(UnifiedTimeSeries reading) {
        return new ReadingDTO(
                reading.getUnifiedObject().getExternalId(),
                reading.getMetric().getMetricKey(),
                reading.getObservedAt(),
                reading.getValue(),
                reading.getExtra()
        );
    }
}
