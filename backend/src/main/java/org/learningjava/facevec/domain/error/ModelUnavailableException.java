package org.learningjava.facevec.domain.error;

/**
 * The inference backend could not be initialized or reached: model file missing,
 * checksum mismatch, or the requested execution provider is not installed.
 */
public class ModelUnavailableException extends FacevecException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
