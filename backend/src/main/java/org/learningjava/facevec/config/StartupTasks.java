package org.learningjava.facevec.config;

import org.learningjava.facevec.application.port.VectorStorePort;
import org.learningjava.facevec.application.usecase.EmbeddingDiagnostics;
import org.learningjava.facevec.domain.error.CollectionUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;

/**
 * Boot-time collection check. An unreachable store is logged, not fatal; the
 * collection stays unverified and the first store call retries.
 */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final VectorStorePort vectorStore;
    private final VectorStoreProperties storeProperties;
    private final EmbeddingDiagnostics diagnostics;

    public StartupTasks(VectorStorePort vectorStore,
                        VectorStoreProperties storeProperties,
                        EmbeddingDiagnostics diagnostics) {
        this.vectorStore = vectorStore;
        this.storeProperties = storeProperties;
        this.diagnostics = diagnostics;
    }

    @Override
    public void run(ApplicationArguments args) {
        EmbeddingDiagnostics.Snapshot snap = diagnostics.snapshot();
        log.info("=== StartupTasks BEGIN === model={} backend={} batchSize={} concurrentBatches={}",
                snap.model().modelName(), snap.model().executionBackend(),
                snap.effectiveBatchSize(), snap.concurrencyLimit());

        try {
            if (!storeProperties.isEnsureOnStartup()) {
                log.info("Collection check disabled (facevec.store.ensure-on-startup=false)");
                return;
            }

            log.info("Checking collection {}", storeProperties.getCollectionName());
            vectorStore.ensureCollectionReady();
            log.info("Collection {} is ready", storeProperties.getCollectionName());
        } catch (CollectionUnavailableException e) {
            log.warn("Collection {} could not be verified at startup, first caller will retry: {}",
                    e.getCollectionName(), e.getMessage());
        } catch (CancellationException e) {
            log.warn("Collection check at startup was cancelled, first caller will retry");
        } finally {
            log.info("=== StartupTasks END ===");
        }
    }
}
