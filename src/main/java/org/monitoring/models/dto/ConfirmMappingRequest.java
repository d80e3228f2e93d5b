package org.monitoring.models.dto;

import org.monitoring.models.mapping.ColumnMapping;

/**
 * @param mapping          the edited mapping, or null to confirm the stored proposal as is
 * @param expectedRevision the dataset revision the caller reviewed, or null to skip the check
 */
public record ConfirmMappingRequest(
        ColumnMapping mapping,
        Long expectedRevision
) {
}
