package org.monitoring.service.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flags for ingestions running in this process.
 */
@Component
public class IngestionCancellationRegistry {

    private final Map<Long, AtomicBoolean> flags = new ConcurrentHashMap<>();

    /**
     * @return the flag of the new run, or null when a run of the dataset is already registered
     */
    public AtomicBoolean register(Long datasetId) {
        AtomicBoolean flag = new AtomicBoolean(false);
        return flags.putIfAbsent(datasetId, flag) == null ? flag : null;
    }

    /**
     * @return false when no ingestion for the dataset runs in this process
     */
    public boolean requestCancel(Long datasetId) {
        AtomicBoolean flag = flags.get(datasetId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        return true;
    }

    public void clear(Long datasetId, AtomicBoolean flag) {
        flags.remove(datasetId, flag);
    }
}
