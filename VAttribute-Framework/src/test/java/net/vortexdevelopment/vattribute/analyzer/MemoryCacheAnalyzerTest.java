package net.vortexdevelopment.vattribute.analyzer;

import net.vortexdevelopment.vattribute.config.AnalyzerSettings;
import net.vortexdevelopment.vattribute.debug.DebugLogger;
import net.vortexdevelopment.vattribute.fixtures.classes.Customer;
import net.vortexdevelopment.vattribute.fixtures.classes.Hierarchy;
import net.vortexdevelopment.vattribute.fixtures.markers.BasicMarker;
import net.vortexdevelopment.vattribute.fixtures.markers.OriginMarker;
import net.vortexdevelopment.vattribute.fixtures.markers.ReflectableMarker;
import net.vortexdevelopment.vattribute.fixtures.markers.StoreMarker;
import net.vortexdevelopment.vattribute.model.MarkerArguments;
import net.vortexdevelopment.vattribute.source.ClassStructureSource;
import net.vortexdevelopment.vattribute.source.DescriptorStructureSource;
import net.vortexdevelopment.vattribute.source.MarkerScanner;
import net.vortexdevelopment.vattribute.source.StructureDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryCacheAnalyzerTest {

    private static DescriptorStructureSource points() {
        return new DescriptorStructureSource(List.of(
                StructureDescriptor.builder("app.Point")
                        .marker(BasicMarker.class, MarkerArguments.named(Map.of("a", 3)))
                        .build(),
                StructureDescriptor.builder("app.Line").build()));
    }

    @Test
    void repeatedAnalysisReturnsSameInstance() {
        MemoryCacheAnalyzer analyzer = new MemoryCacheAnalyzer(new Analyzer(points()));

        BasicMarker first = analyzer.analyze("app.Point", BasicMarker.class);
        BasicMarker second = analyzer.analyze("app.Point", BasicMarker.class);

        assertThat(second).isSameAs(first);
        assertThat(first.a).isEqualTo(3);
        assertThat(analyzer.getCache().getHits()).isEqualTo(1);
    }

    @Test
    void delegateRunsOncePerStructureAndMarkerType() {
        CountingAnalyzer counting = new CountingAnalyzer(new Analyzer(points()));
        MemoryCacheAnalyzer analyzer = new MemoryCacheAnalyzer(counting);

        analyzer.analyze("app.Point", BasicMarker.class);
        analyzer.analyze("app.Point", BasicMarker.class);
        analyzer.analyze("app.Line", BasicMarker.class);
        analyzer.analyze("app.Point", ReflectableMarker.class);
        analyzer.analyze("app.Point", ReflectableMarker.class);

        assertThat(counting.calls).containsExactly("app.Point", "app.Line", "app.Point");
        assertThat(analyzer.getCache().size()).isEqualTo(3);
    }

    @Test
    void classAndNameShareOneEntry() {
        MemoryCacheAnalyzer analyzer = new MemoryCacheAnalyzer(new Analyzer(new ClassStructureSource()));

        StoreMarker byClass = analyzer.analyze(Customer.class, StoreMarker.class);
        StoreMarker byName = analyzer.analyze(Customer.class.getName(), StoreMarker.class);
        StoreMarker byInstance = analyzer.analyze(new Customer(), StoreMarker.class);

        assertThat(byName).isSameAs(byClass);
        assertThat(byInstance).isSameAs(byClass);
    }

    @Test
    void failuresAreNotCached() {
        MemoryCacheAnalyzer analyzer = new MemoryCacheAnalyzer(new Analyzer(points()));

        assertThatThrownBy(() -> analyzer.analyze("app.Unknown", BasicMarker.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(analyzer.getCache().size()).isZero();
    }

    @Test
    void preloadFillsCacheForScannedTypes() {
        MemoryCacheAnalyzer analyzer = new MemoryCacheAnalyzer(new Analyzer(new ClassStructureSource()));
        MarkerScanner scanner = new MarkerScanner("net.vortexdevelopment.vattribute.fixtures");

        int loaded = analyzer.preload(scanner, OriginMarker.class);

        assertThat(loaded).isEqualTo(4);
        assertThat(analyzer.getCache().contains(new AnalysisKey(Hierarchy.Local.class.getName(), OriginMarker.class))).isTrue();
        assertThat(analyzer.analyze(Hierarchy.Local.class, OriginMarker.class).source).isEqualTo("local");
        assertThat(analyzer.getCache().getHits()).isEqualTo(1);
    }

    @Test
    void factoryWrapsEngineOnlyWhenCacheEnabled() {
        ClassAnalyzer cached = Analyzers.create(points(), AnalyzerSettings.defaults());
        ClassAnalyzer plain = Analyzers.create(points(), AnalyzerSettings.builder().cacheEnabled(false).build());

        assertThat(cached).isInstanceOf(MemoryCacheAnalyzer.class);
        assertThat(((MemoryCacheAnalyzer) cached).getDelegate()).isInstanceOf(Analyzer.class);
        assertThat(plain).isInstanceOf(Analyzer.class);
    }

    @Test
    void factoryLeavesDebugLoggingAlone() {
        DebugLogger.clearAll();

        Analyzers.create(points(), AnalyzerSettings.defaults());
        Analyzers.create(points(), AnalyzerSettings.builder().cacheEnabled(false).customMaxDepth(2).build());

        assertThat(DebugLogger.isEnabled(Analyzer.class)).isFalse();
        assertThat(DebugLogger.isEnabled(MemoryCacheAnalyzer.class)).isFalse();
    }

    private static class CountingAnalyzer implements ClassAnalyzer {
        private final ClassAnalyzer delegate;
        private final List<String> calls = new ArrayList<>();

        private CountingAnalyzer(ClassAnalyzer delegate) {
            this.delegate = delegate;
        }

        @Override
        public <T> T analyze(Object subject, Class<T> markerType) {
            calls.add(ClassAnalyzer.structureName(subject));
            return delegate.analyze(subject, markerType);
        }
    }
}
