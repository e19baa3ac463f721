package org.learningjava.facevec.domain.service.embedding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorNormalizerTest {

    @Test
    void normalizes_to_unit_length() {
        float[] v = {3f, 4f};
        VectorNormalizer.normalizeInPlace(v);

        assertEquals(0.6f, v[0], 1e-6);
        assertEquals(0.8f, v[1], 1e-6);
        assertEquals(1.0, VectorNormalizer.magnitude(v), 1e-6);
    }

    @Test
    void leaves_zero_vector_untouched() {
        float[] v = new float[4];
        VectorNormalizer.normalizeInPlace(v);
        assertArrayEquals(new float[4], v);
    }

    @Test
    void slices_flat_output_in_order() {
        float[] out = {2f, 0f, 0f, 0f, 0f, 5f};

        float[][] vectors = VectorNormalizer.sliceAndNormalize(out, 2, 3);

        assertEquals(2, vectors.length);
        assertArrayEquals(new float[]{1f, 0f, 0f}, vectors[0], 1e-6f);
        assertArrayEquals(new float[]{0f, 0f, 1f}, vectors[1], 1e-6f);
    }

    @Test
    void rejects_buffer_of_wrong_length() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> VectorNormalizer.sliceAndNormalize(new float[5], 2, 3));
        assertTrue(ex.getMessage().contains("Expected 6"));
    }
}
