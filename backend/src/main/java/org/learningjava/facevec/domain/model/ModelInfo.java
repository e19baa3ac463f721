package org.learningjava.facevec.domain.model;

import java.time.Instant;

/**
 * Read-only description of the loaded inference backend. Produced once by the
 * runner at startup.
 */
public record ModelInfo(
        String modelName,
        String modelVersion,
        String executionBackend,   // e.g. cpu, cuda, fallback
        String contentHash,        // expected SHA-256 or "n/a"
        Instant loadedAt,
        int vectorSize,
        int inputSize
) {}
