package org.monitoring.service.mapping;

import org.monitoring.models.mapping.ColumnMapping;

import java.util.List;
import java.util.Map;

/**
 * A capability that proposes a column mapping from headers and a handful of sample rows.
 *
 * <p>Implementations throw {@link org.monitoring.exceptions.InferenceUnavailableException} when
 * the capability cannot be reached. Any other exception is treated as an unusable answer.
 */
public interface MappingInferenceClient {

    String name();

    ColumnMapping propose(List<String> headers, List<Map<String, String>> sampleRows);
}
