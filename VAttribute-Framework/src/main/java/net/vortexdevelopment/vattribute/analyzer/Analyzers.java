package net.vortexdevelopment.vattribute.analyzer;

import net.vortexdevelopment.vattribute.config.AnalyzerSettings;
import net.vortexdevelopment.vattribute.instantiate.MarkerTypeRegistry;
import net.vortexdevelopment.vattribute.source.ClassStructureSource;
import net.vortexdevelopment.vattribute.source.StructureSource;

/**
 * Entry point for building analyzers from settings.
 */
public final class Analyzers {

    private Analyzers() {
    }

    /**
     * Analyzer over loaded classes, configured from the environment.
     */
    public static ClassAnalyzer forClasses() {
        return create(new ClassStructureSource(), AnalyzerSettings.fromEnvironment());
    }

    public static ClassAnalyzer create(StructureSource source) {
        return create(source, AnalyzerSettings.fromEnvironment());
    }

    public static ClassAnalyzer create(StructureSource source, AnalyzerSettings settings) {
        Analyzer analyzer = new Analyzer(source, new MarkerTypeRegistry(), settings.getCustomMaxDepth());
        return settings.isCacheEnabled() ? new MemoryCacheAnalyzer(analyzer) : analyzer;
    }
}
