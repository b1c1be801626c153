package net.vortexdevelopment.vattribute.capability;

/**
 * Tag for sub-marker types that may be attached several times to one target.
 */
public interface Multivalue {
}
