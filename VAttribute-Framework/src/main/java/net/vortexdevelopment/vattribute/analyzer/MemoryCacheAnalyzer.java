package net.vortexdevelopment.vattribute.analyzer;

import lombok.Getter;
import net.vortexdevelopment.vattribute.cache.Cache;
import net.vortexdevelopment.vattribute.cache.StaticCache;
import net.vortexdevelopment.vattribute.debug.DebugLogger;
import net.vortexdevelopment.vattribute.source.MarkerScanner;

import java.util.List;

/**
 * Memoizing decorator: remembers every resolved marker by structure and marker type.
 * <p>
 * A result is stored only once the wrapped analyzer has returned it completely, so readers never see
 * a marker that is still being populated. Concurrent misses for the same key may resolve twice;
 * the last result stored wins. Entries are never invalidated.
 */
public class MemoryCacheAnalyzer implements ClassAnalyzer {

    @Getter
    private final ClassAnalyzer delegate;
    @Getter
    private final Cache<AnalysisKey, Object> cache;

    public MemoryCacheAnalyzer(ClassAnalyzer delegate) {
        this(delegate, new StaticCache<>());
    }

    public MemoryCacheAnalyzer(ClassAnalyzer delegate, Cache<AnalysisKey, Object> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public <T> T analyze(Object subject, Class<T> markerType) {
        AnalysisKey key = new AnalysisKey(ClassAnalyzer.structureName(subject), markerType);
        return markerType.cast(cache.get(key, k -> delegate.analyze(subject, markerType)));
    }

    /**
     * Resolve the marker type for every class the scanner finds carrying it.
     *
     * @return number of classes analyzed
     */
    public int preload(MarkerScanner scanner, Class<?> markerType) {
        List<Class<?>> types = scanner.findMarkedTypes(markerType);
        for (Class<?> type : types) {
            analyze(type, markerType);
        }
        DebugLogger.log(MemoryCacheAnalyzer.class, "Preloaded %s for %d classes under %s",
                markerType.getSimpleName(), types.size(), scanner.getRootPackage());
        return types.size();
    }
}
