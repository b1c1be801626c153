package net.vortexdevelopment.vattribute.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a marker has to be built but at least one {@code @Required} field received no value.
 */
@Getter
public class MissingRequiredArgumentsException extends MarkerException {

    private final Class<?> markerType;
    private final List<String> missingFields;

    public MissingRequiredArgumentsException(Class<?> markerType, List<String> missingFields) {
        super("Marker " + markerType.getName() + " is missing required arguments: " + String.join(", ", missingFields));
        this.markerType = markerType;
        this.missingFields = List.copyOf(missingFields);
    }
}
