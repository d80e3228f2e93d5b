package org.monitoring.models.dto;

import org.monitoring.models.entity.DatasetTransition;
import org.monitoring.models.enums.DatasetStatus;

import java.time.Instant;

public record DatasetTransitionDTO(
        DatasetStatus fromStatus,
        DatasetStatus toStatus,
        Long revision,
        String message,
        Instant transitionedAt
) {

    public static DatasetTransitionDTO from(DatasetTransition transition) {
        return new DatasetTransitionDTO(
                transition.getFromStatus(),
                transition.getToStatus(),
                transition.getRevision(),
                transition.getMessage(),
                transition.getTransitionedAt()
        );
    }
}
