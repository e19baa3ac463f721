package org.learningjava.facevec.infrastructure.adapter.out.fallback;

import org.junit.jupiter.api.Test;
import org.learningjava.facevec.domain.model.FloatTensor;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicFallbackRunnerTest {

    private final DeterministicFallbackRunner runner = new DeterministicFallbackRunner();

    @Test
    void same_input_gives_same_output() {
        FloatTensor t = tensor(2, 0.25f);

        float[] a = runner.run("data", t);
        float[] b = new DeterministicFallbackRunner().run("data", t);

        assertEquals(2 * 512, a.length);
        assertArrayEquals(a, b);
    }

    @Test
    void different_items_get_different_vectors() {
        FloatTensor t = tensor(2, 0.25f);
        t.set(1, 0, 0, 0, -1f);

        float[] out = runner.run("data", t);

        float[] first = Arrays.copyOfRange(out, 0, 512);
        float[] second = Arrays.copyOfRange(out, 512, 1024);
        assertFalse(Arrays.equals(first, second));
    }

    @Test
    void values_are_seed_in_unit_range_plus_sine_weight() {
        float[] out = runner.run("data", tensor(1, 0f));

        for (int i = 0; i < 512; i++) {
            float seed = out[i] - (float) Math.sin(i * 0.1f);
            assertTrue(seed >= -1e-5f && seed <= 1f + 1e-5f, "seed out of range at " + i + ": " + seed);
        }
    }

    @Test
    void reports_zero_compute_units_and_fallback_backend() {
        assertEquals(0, runner.activeComputeUnits());
        assertEquals("fallback", runner.modelInfo().executionBackend());
        assertEquals(512, runner.modelInfo().vectorSize());
        assertEquals(112, runner.modelInfo().inputSize());
    }

    private static FloatTensor tensor(int n, float fill) {
        FloatTensor t = new FloatTensor(n, 3, 4, 4);
        Arrays.fill(t.data(), fill);
        return t;
    }
}
