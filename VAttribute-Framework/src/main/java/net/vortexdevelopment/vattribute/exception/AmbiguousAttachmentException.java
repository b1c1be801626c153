package net.vortexdevelopment.vattribute.exception;

import lombok.Getter;
import net.vortexdevelopment.vattribute.model.MarkerTarget;

/**
 * Thrown when a single-valued marker type is attached more than once to the same target.
 */
@Getter
public class AmbiguousAttachmentException extends MarkerException {

    private final MarkerTarget target;
    private final Class<?> markerType;
    private final int count;

    public AmbiguousAttachmentException(MarkerTarget target, Class<?> markerType, int count) {
        super(count + " markers of type " + markerType.getName() + " are attached to " + target
                + " but the type is not multi-value");
        this.target = target;
        this.markerType = markerType;
        this.count = count;
    }
}
