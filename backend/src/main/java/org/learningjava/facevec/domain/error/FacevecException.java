package org.learningjava.facevec.domain.error;

/**
 * Base exception for embedding and vector store failures.
 *
 * <p>Every error raised by the pipeline extends this class, so callers can
 * catch one type when they do not care about the specific kind.</p>
 */
public class FacevecException extends RuntimeException {

    public FacevecException(String message) {
        super(message);
    }

    public FacevecException(String message, Throwable cause) {
        super(message, cause);
    }
}
