package org.learningjava.facevec.domain.model;

import java.time.Duration;

/**
 * Aggregated inference metrics since startup.
 */
public record MetricsSnapshot(
        long batches,
        long vectors,
        long fallbackBatches,
        Duration lastLatency,
        Duration averageLatency,
        String lastExecutionBackend
) {
    public static final MetricsSnapshot EMPTY = new MetricsSnapshot(0, 0, 0, Duration.ZERO, Duration.ZERO, "n/a");
}
