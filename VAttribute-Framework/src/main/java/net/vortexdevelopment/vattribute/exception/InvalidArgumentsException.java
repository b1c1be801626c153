package net.vortexdevelopment.vattribute.exception;

import lombok.Getter;

/**
 * Thrown when raw arguments cannot be bound to a marker's fields.
 */
@Getter
public class InvalidArgumentsException extends MarkerException {

    private final Class<?> markerType;

    public InvalidArgumentsException(Class<?> markerType, String message) {
        super("Cannot bind arguments of " + markerType.getName() + ": " + message);
        this.markerType = markerType;
    }

    public InvalidArgumentsException(Class<?> markerType, String message, Throwable cause) {
        super("Cannot bind arguments of " + markerType.getName() + ": " + message, cause);
        this.markerType = markerType;
    }
}
