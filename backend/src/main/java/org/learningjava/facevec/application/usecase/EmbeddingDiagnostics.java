package org.learningjava.facevec.application.usecase;

import org.learningjava.facevec.application.port.EmbeddingMetricsPort;
import org.learningjava.facevec.domain.model.MetricsSnapshot;
import org.learningjava.facevec.domain.model.ModelInfo;
import org.learningjava.facevec.domain.service.store.CollectionLifecycleManager;

/**
 * Read-only view of the pipeline's state for health pages and logs.
 */
public class EmbeddingDiagnostics {

    public record Snapshot(
            ModelInfo model,
            int effectiveBatchSize,
            int concurrencyLimit,
            MetricsSnapshot metrics,
            String collectionName,
            boolean collectionReady
    ) {}

    private final BatchEmbeddingService embeddings;
    private final EmbeddingMetricsPort metrics;
    private final CollectionLifecycleManager lifecycle;

    public EmbeddingDiagnostics(BatchEmbeddingService embeddings,
                                EmbeddingMetricsPort metrics,
                                CollectionLifecycleManager lifecycle) {
        this.embeddings = embeddings;
        this.metrics = metrics;
        this.lifecycle = lifecycle;
    }

    public Snapshot snapshot() {
        return new Snapshot(
                embeddings.modelInfo(),
                embeddings.effectiveBatchSize(),
                embeddings.concurrencyLimit(),
                metrics.snapshot(),
                lifecycle.collectionName(),
                lifecycle.isReady()
        );
    }
}
