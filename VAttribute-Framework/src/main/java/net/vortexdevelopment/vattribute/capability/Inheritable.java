package net.vortexdevelopment.vattribute.capability;

/**
 * Tag for marker types that are looked up on ancestors when absent locally.
 * <p>
 * Structures search their ancestor classes first, then their contracts. Components only
 * search the same-named component on ancestor classes.
 */
public interface Inheritable {
}
