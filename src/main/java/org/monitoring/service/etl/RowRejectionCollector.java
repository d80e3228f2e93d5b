package org.monitoring.service.etl;

import org.monitoring.models.mapping.RowRejection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, thread-safe accumulator of row rejections. Rejections past the cap are only counted.
 */
public class RowRejectionCollector {

    private final int cap;
    private final List<RowRejection> kept = new ArrayList<>();
    private long total;

    public RowRejectionCollector(int cap) {
        this.cap = Math.max(0, cap);
    }

    public synchronized void add(RowRejection rejection) {
        total++;
        if (kept.size() < cap) {
            kept.add(rejection);
        }
    }

    public synchronized long total() {
        return total;
    }

    public synchronized List<RowRejection> rejections() {
        return List.copyOf(kept);
    }

    public synchronized long overflow() {
        return total - kept.size();
    }

    public synchronized Optional<String> summary() {
        long overflow = total - kept.size();
        return overflow > 0 ? Optional.of(overflow + " additional rows rejected") : Optional.empty();
    }
}
