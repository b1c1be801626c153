package net.vortexdevelopment.vattribute.capability;

import java.util.Map;

/**
 * Structure-level markers that collect a marker for each constant of the structure.
 *
 * @param <C> marker type read from constants
 */
public interface ParsesConstants<C> {

    Class<C> constantMarker();

    default boolean includeConstantsByDefault() {
        return true;
    }

    void setConstants(Map<String, C> constants);
}
