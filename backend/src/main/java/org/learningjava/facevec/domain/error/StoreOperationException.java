package org.learningjava.facevec.domain.error;

/**
 * Network or storage client error during a point operation. No partial
 * document state should be assumed persisted.
 */
public class StoreOperationException extends FacevecException {

    public StoreOperationException(String message) {
        super(message);
    }

    public StoreOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
