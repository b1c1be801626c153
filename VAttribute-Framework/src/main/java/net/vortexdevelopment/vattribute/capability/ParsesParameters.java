package net.vortexdevelopment.vattribute.capability;

import java.util.Map;

/**
 * Method-level markers that collect a marker for each parameter of the method.
 *
 * @param <A> marker type read from parameters
 */
public interface ParsesParameters<A> {

    Class<A> parameterMarker();

    default boolean includeParametersByDefault() {
        return true;
    }

    /**
     * Receives the surviving parameters keyed by name, in positional order.
     */
    void setParameters(Map<String, A> parameters);
}
