package net.vortexdevelopment.vattribute.exception;

/**
 * Base type for every failure raised while resolving markers.
 */
public class MarkerException extends RuntimeException {

    public MarkerException(String message) {
        super(message);
    }

    public MarkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
