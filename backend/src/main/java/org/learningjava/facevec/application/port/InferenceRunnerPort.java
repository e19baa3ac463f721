package org.learningjava.facevec.application.port;

import org.learningjava.facevec.domain.model.FloatTensor;
import org.learningjava.facevec.domain.model.ModelInfo;

/**
 * Executes the embedding model on a batch tensor.
 *
 * <p>Implementations must throw {@link org.learningjava.facevec.domain.error.ModelUnavailableException}
 * when the compute backend cannot be reached rather than silently downgrading.</p>
 */
public interface InferenceRunnerPort {

    ModelInfo modelInfo();

    /**
     * @param inputName  model input the tensor is bound to
     * @param batchTensor {@code [n, 3, S, S]} tensor
     * @return flat buffer of {@code n * vectorSize} floats
     */
    float[] run(String inputName, FloatTensor batchTensor);

    /** Compute units engaged per batch; 0 for a non-model fallback. */
    default int activeComputeUnits() {
        return 1;
    }
}
