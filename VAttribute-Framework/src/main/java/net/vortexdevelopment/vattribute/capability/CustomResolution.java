package net.vortexdevelopment.vattribute.capability;

import net.vortexdevelopment.vattribute.analyzer.ClassAnalyzer;

/**
 * Markers that run their own lookups once every other step is done.
 * <p>
 * Calling back into the analyzer for the same structure and marker type recurses without end
 * unless a depth limit is configured.
 */
public interface CustomResolution {

    void customResolve(ClassAnalyzer analyzer);
}
