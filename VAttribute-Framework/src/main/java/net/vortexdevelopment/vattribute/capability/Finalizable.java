package net.vortexdevelopment.vattribute.capability;

/**
 * Markers that need a last pass once fully populated, e.g. to compute derived fields.
 */
public interface Finalizable {

    void finish();
}
