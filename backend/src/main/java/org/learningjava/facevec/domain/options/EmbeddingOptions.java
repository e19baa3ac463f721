package org.learningjava.facevec.domain.options;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Validated, immutable embedding configuration. Invalid values fail at
 * construction, never on first use.
 */
public record EmbeddingOptions(
        Path modelPath,
        String expectedContentHash,
        boolean verifyChecksum,
        String executionProvider,
        int cudaDeviceId,
        int maxBatchSize,
        double headroomFraction,
        int maxConcurrentBatches,
        boolean fallbackEnabled,
        boolean verboseLogging
) {

    public static final int MAX_BATCH_SIZE_LIMIT = 512;
    public static final String INPUT_NAME = "data";

    public EmbeddingOptions {
        if (modelPath == null) {
            throw new IllegalArgumentException("modelPath is required");
        }
        if (maxBatchSize < 1 || maxBatchSize > MAX_BATCH_SIZE_LIMIT) {
            throw new IllegalArgumentException("maxBatchSize must be within 1.." + MAX_BATCH_SIZE_LIMIT + ", got " + maxBatchSize);
        }
        if (!(headroomFraction >= 0.0 && headroomFraction < 1.0)) {
            throw new IllegalArgumentException("headroomFraction must be within [0,1), got " + headroomFraction);
        }
        if (maxConcurrentBatches < 0) {
            throw new IllegalArgumentException("maxConcurrentBatches must be >= 0, got " + maxConcurrentBatches);
        }
        if (cudaDeviceId < 0 || cudaDeviceId > 15) {
            throw new IllegalArgumentException("cudaDeviceId must be within 0..15, got " + cudaDeviceId);
        }
        executionProvider = executionProvider == null || executionProvider.isBlank()
                ? "cpu"
                : executionProvider.trim().toLowerCase(Locale.ROOT);
        if (!executionProvider.equals("cpu") && !executionProvider.equals("cuda")) {
            throw new IllegalArgumentException("executionProvider must be cpu or cuda, got " + executionProvider);
        }
        expectedContentHash = expectedContentHash == null || expectedContentHash.isBlank()
                ? null
                : expectedContentHash.replace(" ", "").toLowerCase(Locale.ROOT);
    }

    /** Defaults for everything but the model location. */
    public static EmbeddingOptions defaults(Path modelPath) {
        return new EmbeddingOptions(modelPath, null, true, "cpu", 0, 64, 0.1, 0, false, false);
    }

    public int effectiveBatchSize() {
        return Math.max(1, (int) Math.floor(maxBatchSize * (1.0 - headroomFraction)));
    }

    public int concurrencyLimit() {
        if (maxConcurrentBatches > 0) return maxConcurrentBatches;
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    public EmbeddingOptions withBatching(int maxBatchSize, double headroomFraction) {
        return new EmbeddingOptions(modelPath, expectedContentHash, verifyChecksum, executionProvider, cudaDeviceId,
                maxBatchSize, headroomFraction, maxConcurrentBatches, fallbackEnabled, verboseLogging);
    }

    public EmbeddingOptions withFallbackEnabled(boolean enabled) {
        return new EmbeddingOptions(modelPath, expectedContentHash, verifyChecksum, executionProvider, cudaDeviceId,
                maxBatchSize, headroomFraction, maxConcurrentBatches, enabled, verboseLogging);
    }

    public EmbeddingOptions withMaxConcurrentBatches(int limit) {
        return new EmbeddingOptions(modelPath, expectedContentHash, verifyChecksum, executionProvider, cudaDeviceId,
                maxBatchSize, headroomFraction, limit, fallbackEnabled, verboseLogging);
    }

    public EmbeddingOptions withExpectedContentHash(String hash) {
        return new EmbeddingOptions(modelPath, hash, verifyChecksum, executionProvider, cudaDeviceId,
                maxBatchSize, headroomFraction, maxConcurrentBatches, fallbackEnabled, verboseLogging);
    }
}
