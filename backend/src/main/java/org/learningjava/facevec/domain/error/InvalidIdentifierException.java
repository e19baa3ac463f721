package org.learningjava.facevec.domain.error;

/**
 * Thrown when a document id is not a parseable UUID.
 */
public class InvalidIdentifierException extends FacevecException {

    private final String value;

    public InvalidIdentifierException(String value) {
        super("'" + value + "' is not a valid UUID");
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
