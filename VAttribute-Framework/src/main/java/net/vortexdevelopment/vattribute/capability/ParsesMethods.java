package net.vortexdevelopment.vattribute.capability;

import java.util.Map;

/**
 * Structure-level markers that collect a marker for each method of the structure.
 *
 * @param <M> marker type read from methods
 * @see ParsesProperties
 */
public interface ParsesMethods<M> {

    Class<M> methodMarker();

    default boolean includeMethodsByDefault() {
        return true;
    }

    default boolean includeStaticMethods() {
        return true;
    }

    void setMethods(Map<String, M> methods);
}
