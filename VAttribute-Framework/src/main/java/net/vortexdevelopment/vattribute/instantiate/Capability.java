package net.vortexdevelopment.vattribute.instantiate;

import net.vortexdevelopment.vattribute.capability.CustomResolution;
import net.vortexdevelopment.vattribute.capability.Excludable;
import net.vortexdevelopment.vattribute.capability.Finalizable;
import net.vortexdevelopment.vattribute.capability.HasSubMarkers;
import net.vortexdevelopment.vattribute.capability.Inheritable;
import net.vortexdevelopment.vattribute.capability.Multivalue;
import net.vortexdevelopment.vattribute.capability.ParsesConstants;
import net.vortexdevelopment.vattribute.capability.ParsesMethods;
import net.vortexdevelopment.vattribute.capability.ParsesParameters;
import net.vortexdevelopment.vattribute.capability.ParsesProperties;
import net.vortexdevelopment.vattribute.capability.Reflectable;
import net.vortexdevelopment.vattribute.capability.Transitive;

import java.util.EnumSet;

/**
 * Opt-in protocols a marker type can implement.
 */
public enum Capability {

    REFLECTABLE(Reflectable.class),
    PARSES_PROPERTIES(ParsesProperties.class),
    PARSES_METHODS(ParsesMethods.class),
    PARSES_CONSTANTS(ParsesConstants.class),
    PARSES_PARAMETERS(ParsesParameters.class),
    HAS_SUB_MARKERS(HasSubMarkers.class),
    MULTIVALUE(Multivalue.class),
    EXCLUDABLE(Excludable.class),
    INHERITABLE(Inheritable.class),
    TRANSITIVE(Transitive.class),
    CUSTOM_RESOLUTION(CustomResolution.class),
    FINALIZABLE(Finalizable.class);

    private final Class<?> protocol;

    Capability(Class<?> protocol) {
        this.protocol = protocol;
    }

    public static EnumSet<Capability> of(Class<?> markerType) {
        EnumSet<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (Capability capability : values()) {
            if (capability.protocol.isAssignableFrom(markerType)) {
                capabilities.add(capability);
            }
        }
        return capabilities;
    }
}
