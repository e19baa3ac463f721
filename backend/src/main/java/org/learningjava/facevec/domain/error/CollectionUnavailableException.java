package org.learningjava.facevec.domain.error;

/**
 * The target collection could not be listed or created. The readiness flag
 * stays unverified so the next caller retries.
 */
public class CollectionUnavailableException extends FacevecException {

    private final String collectionName;

    public CollectionUnavailableException(String collectionName, Throwable cause) {
        super("Collection '" + collectionName + "' is unavailable: " + cause.getMessage(), cause);
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
