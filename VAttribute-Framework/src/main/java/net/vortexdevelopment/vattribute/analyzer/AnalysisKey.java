package net.vortexdevelopment.vattribute.analyzer;

/**
 * Cache key of one analysis: structure identity plus marker type identity.
 */
public record AnalysisKey(String structure, Class<?> markerType) {

    @Override
    public String toString() {
        return structure + " -> " + markerType.getName();
    }
}
