package net.vortexdevelopment.vattribute.analyzer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the marker of a given type for a structure.
 */
public interface ClassAnalyzer {

    /**
     * Resolve the marker for a structure.
     *
     * @param subject    a qualified structure name, a {@link Class}, or any other object standing for its runtime class
     * @param markerType the marker type to resolve
     * @return the fully populated marker, never null
     */
    <T> T analyze(Object subject, Class<T> markerType);

    /**
     * Resolve the same marker type for several structures.
     *
     * @return markers keyed by structure name, in the order of the subjects
     */
    default <T> Map<String, T> analyzeAll(Collection<?> subjects, Class<T> markerType) {
        Map<String, T> result = new LinkedHashMap<>();
        for (Object subject : subjects) {
            result.put(structureName(subject), analyze(subject, markerType));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Normalize a subject to the structure name it stands for. Strings are taken as names.
     */
    static String structureName(Object subject) {
        Objects.requireNonNull(subject, "subject");
        if (subject instanceof String name) {
            return name;
        }
        if (subject instanceof Class<?> clazz) {
            return clazz.getName();
        }
        return subject.getClass().getName();
    }
}
