package net.vortexdevelopment.vattribute.fixtures.markers;

import net.vortexdevelopment.vattribute.analyzer.ClassAnalyzer;
import net.vortexdevelopment.vattribute.capability.CustomResolution;
import net.vortexdevelopment.vattribute.capability.Reflectable;
import net.vortexdevelopment.vattribute.model.ReflectionFacts;

/**
 * Resolves itself again from its custom hook, which never terminates on its own.
 */
public class RecursiveMarker implements Reflectable, CustomResolution {
    public transient String structure;

    @Override
    public void fromReflection(ReflectionFacts facts) {
        structure = facts.getStructure();
    }

    @Override
    public void customResolve(ClassAnalyzer analyzer) {
        analyzer.analyze(structure, RecursiveMarker.class);
    }
}
