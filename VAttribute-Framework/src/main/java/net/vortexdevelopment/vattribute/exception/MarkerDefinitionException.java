package net.vortexdevelopment.vattribute.exception;

/**
 * Thrown when a marker type itself is malformed, e.g. it cannot be constructed
 * or declares a sub-marker binding that disagrees with the sub-marker's multiplicity.
 */
public class MarkerDefinitionException extends MarkerException {

    public MarkerDefinitionException(String message) {
        super(message);
    }

    public MarkerDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
