package net.vortexdevelopment.vattribute.fixtures.markers;

import net.vortexdevelopment.vattribute.capability.Reflectable;
import net.vortexdevelopment.vattribute.capability.Transitive;
import net.vortexdevelopment.vattribute.model.ReflectionFacts;

public class StoreMarker implements Transitive, Reflectable {
    public String store = "none";
    public transient String resolvedFor;

    @Override
    public void fromReflection(ReflectionFacts facts) {
        resolvedFor = facts.getName();
    }
}
