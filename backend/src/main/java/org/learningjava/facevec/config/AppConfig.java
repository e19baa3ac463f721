package org.learningjava.facevec.config;

import org.learningjava.facevec.application.port.EmbeddingMetricsPort;
import org.learningjava.facevec.application.port.InferenceRunnerPort;
import org.learningjava.facevec.application.port.StorageClientPort;
import org.learningjava.facevec.application.usecase.BatchEmbeddingService;
import org.learningjava.facevec.application.usecase.EmbeddingDiagnostics;
import org.learningjava.facevec.application.usecase.SoftDeleteVectorStore;
import org.learningjava.facevec.domain.error.ModelUnavailableException;
import org.learningjava.facevec.domain.options.EmbeddingOptions;
import org.learningjava.facevec.domain.options.VectorStoreOptions;
import org.learningjava.facevec.domain.service.store.CollectionLifecycleManager;
import org.learningjava.facevec.infrastructure.adapter.out.fallback.DeterministicFallbackRunner;
import org.learningjava.facevec.infrastructure.adapter.out.metrics.InMemoryEmbeddingMetrics;
import org.learningjava.facevec.infrastructure.adapter.out.onnx.OnnxInferenceRunner;
import org.learningjava.facevec.infrastructure.adapter.out.qdrant.QdrantRestStorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    EmbeddingOptions embeddingOptions(EmbeddingProperties props) {
        return props.toOptions();
    }

    @Bean
    VectorStoreOptions vectorStoreOptions(VectorStoreProperties props) {
        return props.toOptions();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    //objects with external dependencies
    @Bean
    DeterministicFallbackRunner fallbackRunner() {
        return new DeterministicFallbackRunner();
    }

    @Bean
    @Primary
    InferenceRunnerPort inferenceRunner(EmbeddingOptions options, DeterministicFallbackRunner fallback) {
        try {
            return new OnnxInferenceRunner(options);
        } catch (ModelUnavailableException e) {
            if (!options.fallbackEnabled()) {
                throw e;
            }
            log.warn("ONNX model unavailable ({}), running in degraded mode with the deterministic fallback",
                    e.getMessage());
            return fallback;
        }
    }

    @Bean
    StorageClientPort storageClient(VectorStoreOptions options) {
        return new QdrantRestStorageClient(options);
    }

    @Bean
    EmbeddingMetricsPort embeddingMetrics() {
        return new InMemoryEmbeddingMetrics();
    }

    @Bean
    BatchEmbeddingService embeddingService(InferenceRunnerPort inferenceRunner,
                                           DeterministicFallbackRunner fallback,
                                           EmbeddingOptions options,
                                           EmbeddingMetricsPort metrics) {
        return new BatchEmbeddingService(inferenceRunner, options.fallbackEnabled() ? fallback : null, options, metrics);
    }

    @Bean
    CollectionLifecycleManager collectionLifecycle(StorageClientPort client, VectorStoreOptions options) {
        return new CollectionLifecycleManager(client, options.collectionName(), options.vectorSize(),
                options.autoCreateCollection());
    }

    @Bean
    SoftDeleteVectorStore vectorStore(StorageClientPort client, VectorStoreOptions options,
                                      CollectionLifecycleManager lifecycle, Clock clock) {
        return new SoftDeleteVectorStore(client, options, lifecycle, clock);
    }

    @Bean
    EmbeddingDiagnostics embeddingDiagnostics(BatchEmbeddingService embeddingService,
                                              EmbeddingMetricsPort metrics,
                                              CollectionLifecycleManager lifecycle) {
        return new EmbeddingDiagnostics(embeddingService, metrics, lifecycle);
    }
}
