package org.monitoring.models.dto;

import org.monitoring.models.entity.UnifiedObject;

import java.time.Instant;
import java.util.Map;

public record UnifiedObjectDTO(
        String externalId,
        String name,
        Double latitude,
        Double longitude,
        Map<String, Object> extra,
        Long lastDatasetId,
        Instant createdAt,
        Instant updatedAt
) {

    public static UnifiedObjectDTO from(UnifiedObject object) {
        return new UnifiedObjectDTO(
                object.getExternalId(),
                object.getName(),
                object.getLatitude(),
                object.getLongitude(),
                object.getExtra(),
                object.getLastDatasetId(),
                object.getCreatedAt(),
                object.getUpdatedAt()
        );
    }
}
