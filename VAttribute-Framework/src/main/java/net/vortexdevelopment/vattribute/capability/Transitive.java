package net.vortexdevelopment.vattribute.capability;

/**
 * Tag for property and parameter markers that fall back to the structure-level marker
 * of the component's declared type.
 */
public interface Transitive {
}
