package net.vortexdevelopment.vattribute.capability;

/**
 * Child-component markers that can remove their component from the parent's map.
 */
public interface Excludable {

    boolean exclude();
}
