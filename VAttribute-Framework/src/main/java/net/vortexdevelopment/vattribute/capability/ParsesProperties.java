package net.vortexdevelopment.vattribute.capability;

import java.util.Map;

/**
 * Structure-level markers that collect a marker for each property of the structure.
 *
 * @param <P> marker type read from properties
 */
public interface ParsesProperties<P> {

    /**
     * The marker type resolved on each property.
     */
    Class<P> propertyMarker();

    /**
     * Whether properties without an attached marker still get a default one.
     * When false they are left out of the map.
     */
    default boolean includePropertiesByDefault() {
        return true;
    }

    default boolean includeStaticProperties() {
        return true;
    }

    /**
     * Receives the surviving properties keyed by name, in declaration order.
     */
    void setProperties(Map<String, P> properties);
}
