package net.vortexdevelopment.vattribute.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * What a structure source reports about one child component.
 *
 * @param name         component name, unique within its kind
 * @param kind         component kind
 * @param declaredType qualified name of the declared type (field type, return type, parameter type), if any
 * @param isStatic     static rather than instance member
 * @param position     zero-based position for parameters, -1 otherwise
 */
public record ComponentDescriptor(@NotNull String name, @NotNull ComponentKind kind, @Nullable String declaredType,
                                  boolean isStatic, int position) {

    public static ComponentDescriptor of(String name, ComponentKind kind, @Nullable String declaredType, boolean isStatic) {
        return new ComponentDescriptor(name, kind, declaredType, isStatic, -1);
    }

    public static ComponentDescriptor parameter(String name, @Nullable String declaredType, int position) {
        return new ComponentDescriptor(name, ComponentKind.PARAMETER, declaredType, false, position);
    }
}
