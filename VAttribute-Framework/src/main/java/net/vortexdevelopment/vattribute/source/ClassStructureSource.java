package net.vortexdevelopment.vattribute.source;

import net.vortexdevelopment.vattribute.annotation.Marker;
import net.vortexdevelopment.vattribute.model.AttachedMarker;
import net.vortexdevelopment.vattribute.model.ComponentDescriptor;
import net.vortexdevelopment.vattribute.model.ComponentKind;
import net.vortexdevelopment.vattribute.model.MarkerArguments;
import net.vortexdevelopment.vattribute.model.MarkerTarget;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.annotation.Repeatable;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Structure source backed by loaded classes.
 * <p>
 * Markers are Java annotations meta-annotated with {@link Marker}. Properties are fields that are not
 * {@code static final}, constants are {@code static final} fields (enum constants included) and methods
 * are declared, non-synthetic methods. Members declared on superclasses are visible on subclasses;
 * a subclass member hides a superclass member of the same name. Fields keep declaration order; the
 * methods of each class are ordered by name, since reflection reports them in no fixed order.
 * Overloaded methods collapse to the overload with the fewest parameters.
 */
public class ClassStructureSource implements StructureSource {

    private static final Comparator<Method> METHOD_ORDER = Comparator.comparing(Method::getName)
            .thenComparingInt(Method::getParameterCount)
            .thenComparing(Method::toString);

    private final ClassLoader classLoader;
    private final Map<String, Optional<Class<?>>> classes = new ConcurrentHashMap<>();
    private final Map<Class<?>, Members> members = new ConcurrentHashMap<>();

    public ClassStructureSource() {
        this(Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : ClassStructureSource.class.getClassLoader());
    }

    public ClassStructureSource(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public boolean isKnown(String structure) {
        return structure != null && findClass(structure) != null;
    }

    @Override
    public boolean isContract(String structure) {
        Class<?> clazz = findClass(structure);
        return clazz != null && clazz.isInterface();
    }

    @Override
    public String shortName(String structure) {
        Class<?> clazz = findClass(structure);
        if (clazz == null || clazz.getSimpleName().isEmpty()) {
            return StructureSource.super.shortName(structure);
        }
        return clazz.getSimpleName();
    }

    @Override
    public List<String> ancestors(String structure) {
        Class<?> clazz = findClass(structure);
        if (clazz == null) {
            return List.of();
        }
        List<String> ancestors = new ArrayList<>();
        for (Class<?> parent = clazz.getSuperclass(); parent != null && parent != Object.class; parent = parent.getSuperclass()) {
            ancestors.add(parent.getName());
        }
        return ancestors;
    }

    /**
     * Own interfaces depth-first with their super-interfaces, then those of each superclass.
     */
    @Override
    public List<String> implementedContracts(String structure) {
        Class<?> clazz = findClass(structure);
        if (clazz == null) {
            return List.of();
        }
        Set<String> contracts = new LinkedHashSet<>();
        for (Class<?> current = clazz; current != null; current = current.getSuperclass()) {
            collectInterfaces(current, contracts);
        }
        contracts.remove(clazz.getName());
        return new ArrayList<>(contracts);
    }

    private void collectInterfaces(Class<?> clazz, Set<String> into) {
        for (Class<?> contract : clazz.getInterfaces()) {
            if (into.add(contract.getName())) {
                collectInterfaces(contract, into);
            }
        }
    }

    @Override
    public List<ComponentDescriptor> components(String structure, ComponentKind kind) {
        Class<?> clazz = findClass(structure);
        if (clazz == null) {
            return List.of();
        }
        Members classMembers = members(clazz);
        return switch (kind) {
            case PROPERTY -> classMembers.properties.values().stream()
                    .map(field -> ComponentDescriptor.of(field.getName(), kind, field.getType().getName(), Modifier.isStatic(field.getModifiers())))
                    .toList();
            case CONSTANT -> classMembers.constants.values().stream()
                    .map(field -> ComponentDescriptor.of(field.getName(), kind, field.getType().getName(), true))
                    .toList();
            case METHOD -> classMembers.methods.values().stream()
                    .map(method -> ComponentDescriptor.of(method.getName(), kind, method.getReturnType().getName(), Modifier.isStatic(method.getModifiers())))
                    .toList();
            default -> throw new IllegalArgumentException("Not a member kind: " + kind);
        };
    }

    @Override
    public List<ComponentDescriptor> parameters(String structure, String method) {
        Method reflected = findMethod(structure, method);
        if (reflected == null) {
            return List.of();
        }
        Parameter[] parameters = reflected.getParameters();
        List<ComponentDescriptor> result = new ArrayList<>(parameters.length);
        for (int i = 0; i < parameters.length; i++) {
            result.add(ComponentDescriptor.parameter(parameters[i].getName(), parameters[i].getType().getName(), i));
        }
        return result;
    }

    @Override
    public List<AttachedMarker> attachedMarkers(MarkerTarget target, Class<?> markerType) {
        AnnotatedElement element = element(target);
        if (element == null) {
            return List.of();
        }
        List<AttachedMarker> result = new ArrayList<>();
        for (Annotation annotation : expandRepeated(element.getDeclaredAnnotations())) {
            Marker binding = annotation.annotationType().getAnnotation(Marker.class);
            if (binding != null && markerType.isAssignableFrom(binding.value())) {
                result.add(AttachedMarker.of(binding.value(), arguments(annotation)));
            }
        }
        return result;
    }

    @Nullable
    private AnnotatedElement element(MarkerTarget target) {
        Class<?> clazz = findClass(target.structure());
        if (clazz == null) {
            return null;
        }
        return switch (target.kind()) {
            case STRUCTURE -> clazz;
            case PROPERTY -> members(clazz).properties.get(target.name());
            case CONSTANT -> members(clazz).constants.get(target.name());
            case METHOD -> members(clazz).methods.get(target.name());
            case PARAMETER -> {
                Method method = members(clazz).methods.get(target.method());
                yield method == null ? null : Arrays.stream(method.getParameters())
                        .filter(parameter -> parameter.getName().equals(target.name()))
                        .findFirst()
                        .orElse(null);
            }
        };
    }

    /**
     * Unwraps container annotations of {@link Repeatable} annotations into their elements.
     */
    private List<Annotation> expandRepeated(Annotation[] annotations) {
        List<Annotation> result = new ArrayList<>();
        for (Annotation annotation : annotations) {
            if (annotation.annotationType().isAnnotationPresent(Marker.class)) {
                result.add(annotation);
                continue;
            }
            Annotation[] repeated = containedAnnotations(annotation);
            if (repeated != null) {
                result.addAll(Arrays.asList(repeated));
            }
        }
        return result;
    }

    @Nullable
    private Annotation[] containedAnnotations(Annotation annotation) {
        Method value;
        try {
            value = annotation.annotationType().getDeclaredMethod("value");
        } catch (NoSuchMethodException e) {
            return null;
        }
        Class<?> returnType = value.getReturnType();
        if (!returnType.isArray() || !returnType.getComponentType().isAnnotation()) {
            return null;
        }
        Repeatable repeatable = returnType.getComponentType().getAnnotation(Repeatable.class);
        if (repeatable == null || repeatable.value() != annotation.annotationType()) {
            return null;
        }
        return (Annotation[]) invoke(value, annotation);
    }

    /**
     * Elements whose value differs from their declared default, in declaration order.
     */
    private MarkerArguments arguments(Annotation annotation) {
        Map<String, Object> named = new LinkedHashMap<>();
        for (Method element : annotation.annotationType().getDeclaredMethods()) {
            if (element.getParameterCount() != 0 || element.isSynthetic()) {
                continue;
            }
            Object value = invoke(element, annotation);
            Object defaultValue = element.getDefaultValue();
            if (defaultValue == null || !Objects.deepEquals(value, defaultValue)) {
                named.put(element.getName(), value);
            }
        }
        return named.isEmpty() ? MarkerArguments.none() : MarkerArguments.named(named);
    }

    private Object invoke(Method element, Annotation annotation) {
        try {
            element.setAccessible(true);
            return element.invoke(annotation);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + annotation.annotationType().getName() + "." + element.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Reading " + annotation.annotationType().getName() + "." + element.getName() + " failed", e.getCause());
        }
    }

    @Nullable
    private Method findMethod(String structure, String name) {
        Class<?> clazz = findClass(structure);
        return clazz == null ? null : members(clazz).methods.get(name);
    }

    @Nullable
    private Class<?> findClass(String name) {
        return classes.computeIfAbsent(name, this::loadClass).orElse(null);
    }

    private Optional<Class<?>> loadClass(String name) {
        try {
            return Optional.of(Class.forName(name, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            return Optional.empty();
        }
    }

    private Members members(Class<?> clazz) {
        return members.computeIfAbsent(clazz, Members::new);
    }

    /**
     * Name-indexed members of a class including inherited ones, nearest declaration first.
     */
    private static final class Members {
        private final Map<String, Field> properties;
        private final Map<String, Field> constants;
        private final Map<String, Method> methods;

        private Members(Class<?> clazz) {
            Map<String, Field> properties = new LinkedHashMap<>();
            Map<String, Field> constants = new LinkedHashMap<>();
            Map<String, Method> methods = new LinkedHashMap<>();
            for (Class<?> current = clazz; current != null && current != Object.class; current = current.getSuperclass()) {
                for (Field field : current.getDeclaredFields()) {
                    if (field.isSynthetic()) {
                        continue;
                    }
                    int modifiers = field.getModifiers();
                    boolean constant = Modifier.isStatic(modifiers) && Modifier.isFinal(modifiers);
                    (constant ? constants : properties).putIfAbsent(field.getName(), field);
                }
                // getDeclaredMethods has no defined order
                Method[] declared = current.getDeclaredMethods();
                Arrays.sort(declared, METHOD_ORDER);
                for (Method method : declared) {
                    if (!method.isSynthetic() && !method.isBridge()) {
                        methods.putIfAbsent(method.getName(), method);
                    }
                }
            }
            this.properties = Collections.unmodifiableMap(properties);
            this.constants = Collections.unmodifiableMap(constants);
            this.methods = Collections.unmodifiableMap(methods);
        }
    }
}
