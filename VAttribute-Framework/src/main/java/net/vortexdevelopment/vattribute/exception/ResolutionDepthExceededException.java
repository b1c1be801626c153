package net.vortexdevelopment.vattribute.exception;

/**
 * Thrown when custom resolution hooks nest deeper than the configured limit.
 */
public class ResolutionDepthExceededException extends MarkerException {

    public ResolutionDepthExceededException(String structure, Class<?> markerType, int maxDepth) {
        super("Custom resolution of " + markerType.getName() + " for " + structure
                + " exceeded the maximum depth of " + maxDepth);
    }
}
