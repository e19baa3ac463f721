package org.learningjava.facevec.domain.error;

public class EmptyResultException extends FacevecException {

    public EmptyResultException(String message) {
        super(message);
    }
}
