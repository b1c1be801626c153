package net.vortexdevelopment.vattribute.capability;

/**
 * Markers that fold sibling markers from the same target into themselves.
 */
public interface HasSubMarkers {

    /**
     * The sub-marker types to look up and the handlers receiving them.
     * Handlers are invoked in binding order.
     */
    SubMarkers subMarkers();
}
