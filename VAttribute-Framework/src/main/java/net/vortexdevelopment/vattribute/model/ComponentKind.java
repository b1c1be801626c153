package net.vortexdevelopment.vattribute.model;

/**
 * The kinds of targets a marker can be attached to.
 */
public enum ComponentKind {

    STRUCTURE,
    PROPERTY,
    METHOD,
    CONSTANT,
    /**
     * A method parameter. Parameters are addressed through their owning method.
     */
    PARAMETER;
}
