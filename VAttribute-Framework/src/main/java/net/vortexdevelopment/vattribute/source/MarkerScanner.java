package net.vortexdevelopment.vattribute.source;

import lombok.Getter;
import net.vortexdevelopment.vattribute.annotation.Marker;
import org.reflections.Configuration;
import org.reflections.Reflections;
import org.reflections.util.ConfigurationBuilder;

import java.lang.annotation.Annotation;
import java.lang.annotation.Repeatable;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds classes in a package that carry markers, so their analysis can be done up front.
 */
@Getter
public class MarkerScanner {

    private final String rootPackage;
    private final Reflections reflections;

    public MarkerScanner(String rootPackage, String... ignoredPackages) {
        this.rootPackage = rootPackage;
        this.reflections = new Reflections(createConfiguration(rootPackage, ignoredPackages));
    }

    /**
     * Restricts scanning to class files under the root package, minus the ignored packages.
     */
    public static Configuration createConfiguration(String rootPackage, String... ignoredPackages) {
        String rootPackagePath = rootPackage.replace('.', '/');

        return new ConfigurationBuilder()
                .forPackage(rootPackage)
                .filterInputsBy(s -> {
                    if (s == null) return false;
                    if (s.startsWith("META-INF")) return false;
                    if (!s.endsWith(".class")) return false;

                    if (!s.startsWith(rootPackagePath + "/")) {
                        return false;
                    }

                    for (String ignoredPackage : ignoredPackages) {
                        if (s.startsWith(ignoredPackage.replace('.', '/') + "/")) {
                            return false;
                        }
                    }
                    return true;
                });
    }

    /**
     * Annotation types in the scanned package bound to a marker class through {@link Marker}.
     */
    public Set<Class<? extends Annotation>> findMarkerAnnotations() {
        return reflections.getTypesAnnotatedWith(Marker.class).stream()
                .filter(Class::isAnnotation)
                .filter(type -> type.isAnnotationPresent(Marker.class))
                .map(MarkerScanner::asAnnotationType)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Classes directly carrying at least one annotation bound to the marker type or a subtype of it,
     * sorted by name. Repeated annotations are found through their container.
     */
    public List<Class<?>> findMarkedTypes(Class<?> markerType) {
        Set<Class<?>> marked = new LinkedHashSet<>();
        for (Class<? extends Annotation> annotation : findMarkerAnnotations()) {
            if (!markerType.isAssignableFrom(annotation.getAnnotation(Marker.class).value())) {
                continue;
            }
            Set<Class<?>> candidates = new LinkedHashSet<>(reflections.getTypesAnnotatedWith(annotation, true));
            Repeatable repeatable = annotation.getAnnotation(Repeatable.class);
            if (repeatable != null) {
                candidates.addAll(reflections.getTypesAnnotatedWith(repeatable.value(), true));
            }
            for (Class<?> type : candidates) {
                if (!type.isAnnotation() && type.getDeclaredAnnotationsByType(annotation).length > 0) {
                    marked.add(type);
                }
            }
        }
        return marked.stream()
                .sorted(Comparator.comparing(Class::getName))
                .toList();
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Annotation> asAnnotationType(Class<?> type) {
        return (Class<? extends Annotation>) type;
    }
}
