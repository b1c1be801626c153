package net.vortexdevelopment.vattribute.capability;

import net.vortexdevelopment.vattribute.model.ReflectionFacts;

/**
 * Markers that want to know about the target they were resolved for.
 * <p>
 * Called right after the marker was found or default-built, before sub-markers and children.
 * Implementations usually fill fields the declaration left unset, e.g. a name.
 */
public interface Reflectable {

    void fromReflection(ReflectionFacts facts);
}
