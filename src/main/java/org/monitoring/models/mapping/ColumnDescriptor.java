package org.monitoring.models.mapping;

import java.io.Serializable;

/**
 * Raw header paired with its normalized variable name.
 */
public record ColumnDescriptor(String original, String variable) implements Serializable {
}
