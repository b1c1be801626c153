package net.vortexdevelopment.vattribute.fixtures.markers;

import net.vortexdevelopment.vattribute.capability.Reflectable;
import net.vortexdevelopment.vattribute.model.ReflectionFacts;

public class ArgMarker implements Reflectable {
    public String alias;
    public transient int position;
    public transient String type;
    public transient String method;

    @Override
    public void fromReflection(ReflectionFacts facts) {
        if (alias == null) {
            alias = facts.getName();
        }
        position = facts.getPosition();
        type = facts.getDeclaredType();
        method = facts.getMethod();
    }
}
