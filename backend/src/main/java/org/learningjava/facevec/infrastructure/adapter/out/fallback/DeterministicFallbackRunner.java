package org.learningjava.facevec.infrastructure.adapter.out.fallback;

import org.learningjava.facevec.application.port.InferenceRunnerPort;
import org.learningjava.facevec.domain.model.FloatTensor;
import org.learningjava.facevec.domain.model.ModelInfo;
import org.learningjava.facevec.domain.service.embedding.ImagePreprocessor;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;

/**
 * CPU stand-in used only when degraded mode is explicitly enabled.
 *
 * <p>Each item's output is the elementwise sum of a seed buffer, filled from a
 * SHA-256 hash chain over the item's tensor bytes (words mapped to [0,1]), and a
 * weight buffer {@code sin(i * 0.1)}. Same input, same vector.</p>
 */
public class DeterministicFallbackRunner implements InferenceRunnerPort {

    public static final int VECTOR_SIZE = 512;

    private final ModelInfo modelInfo = new ModelInfo(
            "deterministic-fallback", "1", "fallback", "n/a", Instant.now(),
            VECTOR_SIZE, ImagePreprocessor.TARGET_SIZE);

    private final float[] weights = new float[VECTOR_SIZE];

    public DeterministicFallbackRunner() {
        for (int i = 0; i < VECTOR_SIZE; i++) {
            weights[i] = (float) Math.sin(i * 0.1f);
        }
    }

    @Override
    public ModelInfo modelInfo() {
        return modelInfo;
    }

    @Override
    public int activeComputeUnits() {
        return 0;
    }

    @Override
    public float[] run(String inputName, FloatTensor batchTensor) {
        int batchSize = batchTensor.dimension(0);
        float[] out = new float[batchSize * VECTOR_SIZE];
        for (int item = 0; item < batchSize; item++) {
            float[] seed = seedFor(batchTensor.itemBytes(item));
            int base = item * VECTOR_SIZE;
            for (int i = 0; i < VECTOR_SIZE; i++) {
                out[base + i] = seed[i] + weights[i];
            }
        }
        return out;
    }

    private static float[] seedFor(byte[] itemBytes) {
        MessageDigest sha;
        try {
            sha = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        float[] seed = new float[VECTOR_SIZE];
        byte[] state = itemBytes;
        int cursor = 0;
        while (cursor < VECTOR_SIZE) {
            state = sha.digest(state);
            ByteBuffer words = ByteBuffer.wrap(state);
            while (words.remaining() >= Integer.BYTES && cursor < VECTOR_SIZE) {
                long unsigned = Integer.toUnsignedLong(words.getInt());
                seed[cursor++] = (float) (unsigned / (double) 0xFFFFFFFFL);
            }
        }
        return seed;
    }
}
