package org.learningjava.facevec.application.port;

import org.learningjava.facevec.domain.model.BatchMetrics;
import org.learningjava.facevec.domain.model.MetricsSnapshot;

/**
 * Observability sink for inference flushes. Injected so the core holds no
 * global telemetry state.
 */
public interface EmbeddingMetricsPort {

    void recordBatch(BatchMetrics metrics);

    default MetricsSnapshot snapshot() {
        return MetricsSnapshot.EMPTY;
    }

    EmbeddingMetricsPort NOOP = metrics -> { };
}
