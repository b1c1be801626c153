package net.vortexdevelopment.vattribute.instantiate;

import lombok.Getter;
import net.vortexdevelopment.vattribute.annotation.Required;
import net.vortexdevelopment.vattribute.exception.MarkerDefinitionException;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analyzer needs to know about a marker class, computed once.
 */
public class MarkerTypeDescriptor {

    @Getter
    private final Class<?> type;
    private final Set<Capability> capabilities;
    @Getter
    private final List<Field> fields;
    private final Map<String, Field> fieldsByName;
    private final Constructor<?> constructor;

    MarkerTypeDescriptor(Class<?> type) {
        if (type.isInterface() || type.isAnnotation() || Modifier.isAbstract(type.getModifiers())) {
            throw new MarkerDefinitionException("Marker type " + type.getName() + " must be a concrete class");
        }
        this.type = type;
        this.capabilities = Collections.unmodifiableSet(Capability.of(type));
        this.fields = Collections.unmodifiableList(collectFields(type));
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.constructor = findConstructor(type);
    }

    /**
     * Bindable fields, superclass fields first, each class in declaration order.
     * A subclass field shadowing a superclass field of the same name replaces it.
     */
    private static List<Field> collectFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }
        Map<String, Field> result = new LinkedHashMap<>();
        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                // final and transient fields hold derived state, not arguments
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || Modifier.isFinal(modifiers)
                        || field.isSynthetic()) {
                    continue;
                }
                field.setAccessible(true);
                result.remove(field.getName());
                result.put(field.getName(), field);
            }
        }
        return new ArrayList<>(result.values());
    }

    private static Constructor<?> findConstructor(Class<?> type) {
        if (type.getEnclosingClass() != null && !Modifier.isStatic(type.getModifiers())) {
            throw new MarkerDefinitionException("Marker type " + type.getName() + " is an inner class; make it static");
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            throw new MarkerDefinitionException("Marker type " + type.getName() + " has no no-arg constructor", e);
        }
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public Set<Capability> getCapabilities() {
        return capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(capabilities);
    }

    @Nullable
    public Field getField(String name) {
        return fieldsByName.get(name);
    }

    public boolean isRequired(Field field) {
        return field.isAnnotationPresent(Required.class);
    }

    Object newInstance() {
        try {
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MarkerDefinitionException("Failed to construct marker " + type.getName(), cause);
        }
    }

    @Override
    public String toString() {
        return "MarkerTypeDescriptor{" + type.getName() + ", capabilities=" + capabilities + '}';
    }
}
