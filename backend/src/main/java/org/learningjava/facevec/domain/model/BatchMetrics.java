package org.learningjava.facevec.domain.model;

import java.time.Duration;

/**
 * Measurements for one inference flush. {@code activeComputeUnits == 0} marks a
 * batch computed by the deterministic fallback instead of the model.
 */
public record BatchMetrics(
        int batchSize,
        Duration latency,
        int activeComputeUnits,
        String executionBackend,
        boolean fallback
) {}
