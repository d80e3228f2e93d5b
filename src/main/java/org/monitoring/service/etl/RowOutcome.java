package org.monitoring.service.etl;

import org.monitoring.models.mapping.RowRejection;

import java.time.Instant;
import java.util.Map;

/**
 * What one raw row contributes: an entity, a reading, a rejection, or a mix.
 * A row with a rejection may still carry an entity when only its reading part was bad.
 */
public record RowOutcome(long rowNumber, EntityDraft entity, ReadingDraft reading, RowRejection rejection) {

    public boolean rejected() {
        return rejection != null;
    }

    public record EntityDraft(String externalId, Double latitude, Double longitude, Map<String, Object> extra) {
    }

    public record ReadingDraft(String externalId, String metricName, Instant observedAt, double value,
                               Map<String, Object> extra) {
    }
}
