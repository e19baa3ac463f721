package org.learningjava.facevec.domain.error;

public class ImageDecodeException extends FacevecException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
