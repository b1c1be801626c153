package net.vortexdevelopment.vattribute.instantiate;

import net.vortexdevelopment.vattribute.debug.DebugLogger;
import net.vortexdevelopment.vattribute.exception.InvalidArgumentsException;
import net.vortexdevelopment.vattribute.exception.MissingRequiredArgumentsException;
import net.vortexdevelopment.vattribute.model.MarkerArguments;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds marker instances from raw arguments.
 * <p>
 * Positional arguments bind to the marker's fields in order, named arguments by field name.
 * Fields nobody supplied keep their initializer value, unless they are {@code @Required}.
 */
public class MarkerInstantiator {

    private final MarkerTypeRegistry registry;
    private final ValueConverter converter;

    public MarkerInstantiator(MarkerTypeRegistry registry) {
        this(registry, new ValueConverter());
    }

    public MarkerInstantiator(MarkerTypeRegistry registry, ValueConverter converter) {
        this.registry = registry;
        this.converter = converter;
    }

    /**
     * Build a marker with all defaults.
     */
    public <T> T instantiate(Class<T> markerType) {
        return instantiate(markerType, MarkerArguments.none());
    }

    public <T> T instantiate(Class<T> markerType, MarkerArguments arguments) {
        MarkerTypeDescriptor descriptor = registry.describe(markerType);
        List<Field> fields = descriptor.getFields();
        List<Object> positional = arguments.getPositional();
        if (positional.size() > fields.size()) {
            throw new InvalidArgumentsException(markerType, positional.size() + " positional arguments given but only "
                    + fields.size() + " fields exist");
        }

        Object instance = descriptor.newInstance();
        Set<String> supplied = new HashSet<>();

        for (int i = 0; i < positional.size(); i++) {
            Field field = fields.get(i);
            bind(descriptor, instance, field, positional.get(i));
            supplied.add(field.getName());
        }

        for (Map.Entry<String, Object> entry : arguments.getNamed().entrySet()) {
            Field field = descriptor.getField(entry.getKey());
            if (field == null) {
                throw new InvalidArgumentsException(markerType, "unknown argument '" + entry.getKey() + "'");
            }
            if (!supplied.add(field.getName())) {
                throw new InvalidArgumentsException(markerType, "argument '" + entry.getKey() + "' is bound twice");
            }
            bind(descriptor, instance, field, entry.getValue());
        }

        List<String> missing = new ArrayList<>();
        for (Field field : fields) {
            if (descriptor.isRequired(field) && !supplied.contains(field.getName())) {
                missing.add(field.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredArgumentsException(markerType, missing);
        }

        DebugLogger.log(MarkerInstantiator.class, "Built %s from %s", markerType.getSimpleName(), arguments);
        return markerType.cast(instance);
    }

    private void bind(MarkerTypeDescriptor descriptor, Object instance, Field field, Object rawValue) {
        Object value;
        try {
            value = converter.convert(rawValue, field.getType());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentsException(descriptor.getType(), "argument '" + field.getName() + "': " + e.getMessage(), e);
        }
        try {
            field.set(instance, value);
        } catch (IllegalAccessException e) {
            throw new InvalidArgumentsException(descriptor.getType(), "field '" + field.getName() + "' is not writable", e);
        }
    }
}
