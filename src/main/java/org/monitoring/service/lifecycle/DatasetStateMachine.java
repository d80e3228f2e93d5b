package org.monitoring.service.lifecycle;

import org.monitoring.models.enums.DatasetStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.monitoring.models.enums.DatasetStatus.ANALYZED;
import static org.monitoring.models.enums.DatasetStatus.ANALYZING;
import static org.monitoring.models.enums.DatasetStatus.CONFIRMED;
import static org.monitoring.models.enums.DatasetStatus.FAILED;
import static org.monitoring.models.enums.DatasetStatus.INGESTED;
import static org.monitoring.models.enums.DatasetStatus.INGESTING;
import static org.monitoring.models.enums.DatasetStatus.UPLOADED;

/**
 * Allowed dataset status transitions. INGESTED and non-retryable FAILED are terminal.
 */
public final class DatasetStateMachine {

    private static final Map<DatasetStatus, Set<DatasetStatus>> ALLOWED = new EnumMap<>(DatasetStatus.class);

    static {
        ALLOWED.put(UPLOADED, EnumSet.of(ANALYZING));
        ALLOWED.put(ANALYZING, EnumSet.of(ANALYZED, FAILED));
        ALLOWED.put(ANALYZED, EnumSet.of(ANALYZING, CONFIRMED, FAILED));
        ALLOWED.put(CONFIRMED, EnumSet.of(INGESTING, FAILED));
        ALLOWED.put(INGESTING, EnumSet.of(INGESTED, FAILED));
        ALLOWED.put(INGESTED, EnumSet.noneOf(DatasetStatus.class));
        ALLOWED.put(FAILED, EnumSet.of(ANALYZING, INGESTING));
    }

    private DatasetStateMachine() {
    }

    public static boolean canTransition(DatasetStatus from, boolean retryable, DatasetStatus to) {
        if (from == null || to == null) {
            return false;
        }
        if (from == FAILED && !retryable) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    public static Set<DatasetStatus> targets(DatasetStatus from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    public static boolean isTerminal(DatasetStatus status, boolean retryable) {
        return status == INGESTED || (status == FAILED && !retryable);
    }
}
