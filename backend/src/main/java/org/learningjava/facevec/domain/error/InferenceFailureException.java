package org.learningjava.facevec.domain.error;

/**
 * A single inference batch failed. Vectors produced by earlier batches of the
 * same stream stay valid.
 */
public class InferenceFailureException extends FacevecException {

    private final int batchSize;

    public InferenceFailureException(String message, int batchSize) {
        super(message);
        this.batchSize = batchSize;
    }

    public InferenceFailureException(String message, int batchSize, Throwable cause) {
        super(message, cause);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
