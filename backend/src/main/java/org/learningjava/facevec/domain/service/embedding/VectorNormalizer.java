package org.learningjava.facevec.domain.service.embedding;

/**
 * L2 normalization and slicing of flat model output.
 */
public final class VectorNormalizer {

    // below this magnitude the vector is treated as zero and left untouched
    static final double EPSILON = 1e-9;

    private VectorNormalizer() {}

    public static void normalizeInPlace(float[] vector) {
        double magnitude = magnitude(vector);
        if (magnitude < EPSILON) {
            return;
        }
        double scale = 1.0 / magnitude;
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] * scale);
        }
    }

    public static double magnitude(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Splits {@code output} into {@code batchSize} normalized vectors of
     * {@code vectorSize} floats, in order.
     *
     * @throws IllegalArgumentException if the buffer length is not {@code batchSize * vectorSize}
     */
    public static float[][] sliceAndNormalize(float[] output, int batchSize, int vectorSize) {
        long expected = (long) batchSize * vectorSize;
        if (output == null || output.length != expected) {
            throw new IllegalArgumentException("Unexpected output size from model. Expected "
                    + expected + ", got " + (output == null ? "null" : output.length));
        }
        float[][] vectors = new float[batchSize][];
        for (int i = 0; i < batchSize; i++) {
            float[] v = new float[vectorSize];
            System.arraycopy(output, i * vectorSize, v, 0, vectorSize);
            normalizeInPlace(v);
            vectors[i] = v;
        }
        return vectors;
    }
}
