package org.learningjava.facevec.infrastructure.adapter.out.metrics;

import org.learningjava.facevec.application.port.EmbeddingMetricsPort;
import org.learningjava.facevec.domain.model.BatchMetrics;
import org.learningjava.facevec.domain.model.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local counters for inference flushes, readable through {@link #snapshot()}.
 */
public class InMemoryEmbeddingMetrics implements EmbeddingMetricsPort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEmbeddingMetrics.class);

    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong vectors = new AtomicLong();
    private final AtomicLong fallbackBatches = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();
    private final AtomicReference<BatchMetrics> last = new AtomicReference<>();

    @Override
    public void recordBatch(BatchMetrics metrics) {
        batches.incrementAndGet();
        vectors.addAndGet(metrics.batchSize());
        totalLatencyNanos.addAndGet(metrics.latency().toNanos());
        if (metrics.fallback()) {
            fallbackBatches.incrementAndGet();
        }
        last.set(metrics);
        log.debug("batch size={} latencyMs={} units={} backend={} fallback={}",
                metrics.batchSize(), metrics.latency().toMillis(), metrics.activeComputeUnits(),
                metrics.executionBackend(), metrics.fallback());
    }

    @Override
    public MetricsSnapshot snapshot() {
        long count = batches.get();
        BatchMetrics lastBatch = last.get();
        if (count == 0 || lastBatch == null) {
            return MetricsSnapshot.EMPTY;
        }
        return new MetricsSnapshot(
                count,
                vectors.get(),
                fallbackBatches.get(),
                lastBatch.latency(),
                Duration.ofNanos(totalLatencyNanos.get() / count),
                lastBatch.executionBackend()
        );
    }
}
