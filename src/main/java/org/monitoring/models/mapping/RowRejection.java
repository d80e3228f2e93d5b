package org.monitoring.models.mapping;

import org.monitoring.models.enums.RejectionCode;

import java.io.Serializable;
import java.util.List;

public record RowRejection(
        long rowNumber,
        RejectionCode code,
        List<String> columns,
        String message
) implements Serializable {
}
