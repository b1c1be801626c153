package net.vortexdevelopment.vattribute.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Addresses the place markers are read from: a structure or one of its components.
 *
 * @param structure qualified name of the structure
 * @param kind      what is addressed
 * @param name      component name, null for the structure itself
 * @param method    owning method name, only for parameters
 */
public record MarkerTarget(@NotNull String structure, @NotNull ComponentKind kind, @Nullable String name, @Nullable String method) {

    public MarkerTarget {
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(kind, "kind");
        if (kind != ComponentKind.STRUCTURE && name == null) {
            throw new IllegalArgumentException("Component target of kind " + kind + " needs a name");
        }
        if (kind == ComponentKind.PARAMETER && method == null) {
            throw new IllegalArgumentException("Parameter target needs its owning method");
        }
    }

    public static MarkerTarget structure(String structure) {
        return new MarkerTarget(structure, ComponentKind.STRUCTURE, null, null);
    }

    public static MarkerTarget property(String structure, String name) {
        return new MarkerTarget(structure, ComponentKind.PROPERTY, name, null);
    }

    public static MarkerTarget method(String structure, String name) {
        return new MarkerTarget(structure, ComponentKind.METHOD, name, null);
    }

    public static MarkerTarget constant(String structure, String name) {
        return new MarkerTarget(structure, ComponentKind.CONSTANT, name, null);
    }

    public static MarkerTarget parameter(String structure, String method, String name) {
        return new MarkerTarget(structure, ComponentKind.PARAMETER, name, method);
    }

    /**
     * Target of a component of the given kind that belongs to this target's structure
     * (or, for parameters, to this method).
     */
    public MarkerTarget child(ComponentKind childKind, String childName) {
        if (childKind == ComponentKind.PARAMETER) {
            if (kind != ComponentKind.METHOD) {
                throw new IllegalArgumentException("Only methods have parameters, not " + this);
            }
            return parameter(structure, name, childName);
        }
        return new MarkerTarget(structure, childKind, childName, null);
    }

    /**
     * The same component, looked up on another structure.
     */
    public MarkerTarget retarget(String otherStructure) {
        return new MarkerTarget(otherStructure, kind, name, method);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STRUCTURE -> structure;
            case PARAMETER -> structure + "::" + method + "($" + name + ")";
            case METHOD -> structure + "::" + name + "()";
            default -> structure + "::" + name;
        };
    }
}
