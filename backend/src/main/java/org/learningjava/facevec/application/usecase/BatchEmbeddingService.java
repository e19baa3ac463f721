package org.learningjava.facevec.application.usecase;

import org.learningjava.facevec.application.port.EmbeddingMetricsPort;
import org.learningjava.facevec.application.port.EmbeddingPort;
import org.learningjava.facevec.application.port.InferenceRunnerPort;
import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.error.EmptyResultException;
import org.learningjava.facevec.domain.error.InferenceFailureException;
import org.learningjava.facevec.domain.error.ModelUnavailableException;
import org.learningjava.facevec.domain.model.BatchMetrics;
import org.learningjava.facevec.domain.model.FloatTensor;
import org.learningjava.facevec.domain.model.ModelInfo;
import org.learningjava.facevec.domain.options.EmbeddingOptions;
import org.learningjava.facevec.domain.service.embedding.ImagePreprocessor;
import org.learningjava.facevec.domain.service.embedding.VectorNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Batches preprocessed face crops, throttles concurrent inference and emits
 * L2-normalized vectors in input order.
 *
 * <p>Batches are {@code floor(maxBatchSize * (1 - headroom))} items (at least 1).
 * At most {@link EmbeddingOptions#concurrencyLimit()} batches run inference at the
 * same time across all callers; the rest wait on the gate.</p>
 *
 * <p>When the runner reports {@link ModelUnavailableException} and the fallback is
 * explicitly enabled, the batch is recomputed by the fallback runner and its
 * metrics are flagged with {@code activeComputeUnits == 0}.</p>
 */
public class BatchEmbeddingService implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(BatchEmbeddingService.class);

    private final InferenceRunnerPort runner;
    private final InferenceRunnerPort fallbackRunner;
    private final EmbeddingOptions options;
    private final EmbeddingMetricsPort metrics;
    private final int effectiveBatchSize;
    private final int concurrencyLimit;
    private final Semaphore gate;
    private final ModelInfo modelInfo;

    public BatchEmbeddingService(InferenceRunnerPort runner,
                                 InferenceRunnerPort fallbackRunner,
                                 EmbeddingOptions options,
                                 EmbeddingMetricsPort metrics) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.options = Objects.requireNonNull(options, "options");
        this.metrics = metrics == null ? EmbeddingMetricsPort.NOOP : metrics;
        if (options.fallbackEnabled() && fallbackRunner == null) {
            throw new IllegalArgumentException("fallbackEnabled requires a fallback runner");
        }
        this.fallbackRunner = options.fallbackEnabled() ? fallbackRunner : null;
        this.effectiveBatchSize = options.effectiveBatchSize();
        this.concurrencyLimit = options.concurrencyLimit();
        this.gate = new Semaphore(concurrencyLimit, true);
        this.modelInfo = runner.modelInfo();

        log.info("Embedding model {} ({}) on {} | batchSize={} | headroom={}% | concurrentBatches={} | fallback={}",
                modelInfo.modelName(), modelInfo.modelVersion(), modelInfo.executionBackend(),
                effectiveBatchSize, Math.round(options.headroomFraction() * 100), concurrencyLimit,
                options.fallbackEnabled() ? "enabled" : "disabled");
    }

    public BatchEmbeddingService(InferenceRunnerPort runner, EmbeddingOptions options, EmbeddingMetricsPort metrics) {
        this(runner, null, options, metrics);
    }

    @Override
    public ModelInfo modelInfo() {
        return modelInfo;
    }

    public int effectiveBatchSize() {
        return effectiveBatchSize;
    }

    public int concurrencyLimit() {
        return concurrencyLimit;
    }

    @Override
    public float[] generate(byte[] image, CancellationToken cancellation) {
        Objects.requireNonNull(image, "image");
        try (Stream<float[]> vectors = generateBatch(List.of(image), cancellation)) {
            return vectors.findFirst()
                    .orElseThrow(() -> new EmptyResultException("Embedding generation produced no output"));
        }
    }

    @Override
    public Stream<float[]> generateBatch(Iterable<byte[]> images, CancellationToken cancellation) {
        Objects.requireNonNull(images, "images");
        Objects.requireNonNull(cancellation, "cancellation");
        Iterator<float[]> it = new BatchingIterator(images, cancellation);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private float[][] runInference(List<FloatTensor> tensors, CancellationToken cancellation) {
        int n = tensors.size();
        cancellation.throwIfCancellationRequested();
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for an inference slot");
        }
        try {
            cancellation.throwIfCancellationRequested();
            FloatTensor batch = FloatTensor.concatenate(tensors);

            long t0 = System.nanoTime();
            InferenceRunnerPort used = runner;
            float[] raw;
            try {
                raw = runner.run(EmbeddingOptions.INPUT_NAME, batch);
            } catch (ModelUnavailableException e) {
                if (fallbackRunner == null) {
                    throw new InferenceFailureException("Inference backend unavailable for batch of " + n, n, e);
                }
                log.warn("Inference backend unavailable ({}); computing batch of {} with deterministic fallback",
                        e.getMessage(), n);
                used = fallbackRunner;
                raw = runFallback(batch, n);
            } catch (CancellationException | InferenceFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InferenceFailureException("Inference failed for batch of " + n + ": " + e.getMessage(), n, e);
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - t0);

            float[][] vectors;
            try {
                vectors = VectorNormalizer.sliceAndNormalize(raw, n, modelInfo.vectorSize());
            } catch (IllegalArgumentException e) {
                throw new InferenceFailureException(e.getMessage(), n, e);
            }

            int units = used.activeComputeUnits();
            boolean fallback = used != runner || units == 0;
            metrics.recordBatch(new BatchMetrics(n, latency, units, used.modelInfo().executionBackend(), fallback));

            if (options.verboseLogging()) {
                log.debug("Inference finished for batch {} in {} ms (backend={}, units={})",
                        n, latency.toMillis(), used.modelInfo().executionBackend(), units);
            }
            return vectors;
        } finally {
            gate.release();
        }
    }

    private float[] runFallback(FloatTensor batch, int n) {
        try {
            return fallbackRunner.run(EmbeddingOptions.INPUT_NAME, batch);
        } catch (RuntimeException e) {
            throw new InferenceFailureException("Fallback inference failed for batch of " + n, n, e);
        }
    }

    /**
     * Pulls inputs on demand; one flush per {@code effectiveBatchSize} items plus a
     * final partial flush. Forward-only.
     */
    private final class BatchingIterator implements Iterator<float[]> {

        private final Iterable<byte[]> source;
        private final CancellationToken cancellation;
        private final Deque<float[]> ready = new ArrayDeque<>();
        private Iterator<byte[]> inputs;
        private boolean exhausted;
        private boolean failed;

        BatchingIterator(Iterable<byte[]> source, CancellationToken cancellation) {
            this.source = source;
            this.cancellation = cancellation;
        }

        @Override
        public boolean hasNext() {
            // a failed batch ends the stream
            while (ready.isEmpty() && !exhausted && !failed) {
                try {
                    fillNextBatch();
                } catch (RuntimeException e) {
                    failed = true;
                    throw e;
                }
            }
            return !ready.isEmpty();
        }

        @Override
        public float[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        private void fillNextBatch() {
            cancellation.throwIfCancellationRequested();
            if (inputs == null) {
                inputs = source.iterator();
            }
            List<FloatTensor> tensors = new ArrayList<>(effectiveBatchSize);
            while (tensors.size() < effectiveBatchSize) {
                if (!inputs.hasNext()) {
                    exhausted = true;
                    break;
                }
                cancellation.throwIfCancellationRequested();
                tensors.add(ImagePreprocessor.toTensor(inputs.next()));
            }
            if (!tensors.isEmpty()) {
                ready.addAll(Arrays.asList(runInference(tensors, cancellation)));
            }
        }
    }
}
