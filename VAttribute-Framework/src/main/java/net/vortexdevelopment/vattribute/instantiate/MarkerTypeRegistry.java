package net.vortexdevelopment.vattribute.instantiate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches {@link MarkerTypeDescriptor}s so capabilities and fields are derived once per marker class.
 */
public class MarkerTypeRegistry {

    private final Map<Class<?>, MarkerTypeDescriptor> descriptors;

    public MarkerTypeRegistry() {
        this.descriptors = new ConcurrentHashMap<>();
    }

    public MarkerTypeDescriptor describe(Class<?> markerType) {
        return descriptors.computeIfAbsent(markerType, MarkerTypeDescriptor::new);
    }

    public boolean has(Class<?> markerType, Capability capability) {
        return describe(markerType).has(capability);
    }

    public int size() {
        return descriptors.size();
    }
}
