package net.vortexdevelopment.vattribute.instantiate;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Coerces raw argument values to the type of the marker field they are bound to.
 */
public class ValueConverter {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            boolean.class, Boolean.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            char.class, Character.class
    );

    private final ClassLoader classLoader;

    public ValueConverter() {
        this(ValueConverter.class.getClassLoader());
    }

    public ValueConverter(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Convert a raw value to the target type.
     *
     * @param value      The raw value, possibly null
     * @param targetType The field type
     * @return The converted value
     * @throws IllegalArgumentException if the value cannot be represented as the target type
     */
    @Nullable
    public Object convert(@Nullable Object value, Class<?> targetType) {
        if (value == null) {
            if (targetType.isPrimitive()) {
                throw new IllegalArgumentException("null cannot be assigned to primitive " + targetType.getName());
            }
            return null;
        }

        Class<?> boxed = box(targetType);
        if (boxed.isInstance(value)) {
            return value;
        }

        if (value instanceof String string) {
            return fromString(string, boxed);
        }
        if (value instanceof Number number) {
            return fromNumber(number, boxed);
        }
        if (targetType.isArray() && value instanceof Collection<?> collection) {
            return toArray(collection, targetType.getComponentType());
        }
        if (List.class.isAssignableFrom(targetType) && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return List.copyOf(list);
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to " + targetType.getName());
    }

    private Object fromString(String value, Class<?> targetType) {
        try {
            if (targetType == Integer.class) {
                return Integer.parseInt(value.trim());
            } else if (targetType == Long.class) {
                return Long.parseLong(value.trim());
            } else if (targetType == Boolean.class) {
                return Boolean.parseBoolean(value.trim());
            } else if (targetType == Double.class) {
                return Double.parseDouble(value.trim());
            } else if (targetType == Float.class) {
                return Float.parseFloat(value.trim());
            } else if (targetType == Short.class) {
                return Short.parseShort(value.trim());
            } else if (targetType == Byte.class) {
                return Byte.parseByte(value.trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot convert '" + value + "' to " + targetType.getSimpleName(), e);
        }

        if (targetType == Character.class && value.length() == 1) {
            return value.charAt(0);
        }
        if (targetType.isEnum()) {
            return enumConstant(targetType, value.trim());
        }
        if (targetType == Class.class) {
            try {
                return Class.forName(value.trim(), false, classLoader);
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException("Unknown class '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("Cannot convert '" + value + "' to " + targetType.getName());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object enumConstant(Class<?> enumType, String name) {
        return Enum.valueOf((Class<? extends Enum>) enumType, name);
    }

    private Object fromNumber(Number number, Class<?> targetType) {
        if (targetType == Long.class && !isFloatingPoint(number)) {
            return number.longValue();
        } else if (targetType == Double.class) {
            return number.doubleValue();
        } else if (targetType == Float.class && fitsFloat(number)) {
            return number.floatValue();
        } else if (targetType == Integer.class && fitsInt(number)) {
            return number.intValue();
        } else if (targetType == Short.class && fitsInt(number) && number.intValue() == number.shortValue()) {
            return number.shortValue();
        } else if (targetType == Byte.class && fitsInt(number) && number.intValue() == number.byteValue()) {
            return number.byteValue();
        } else if (targetType == String.class) {
            return number.toString();
        }
        throw new IllegalArgumentException("Cannot convert " + number + " to " + targetType.getName());
    }

    private boolean isFloatingPoint(Number number) {
        return number instanceof Double || number instanceof Float;
    }

    private boolean fitsFloat(Number number) {
        double value = number.doubleValue();
        return Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) <= Float.MAX_VALUE;
    }

    private boolean fitsInt(Number number) {
        if (isFloatingPoint(number)) {
            return false;
        }
        long value = number.longValue();
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private Object toArray(Collection<?> values, Class<?> componentType) {
        Object array = Array.newInstance(componentType, values.size());
        int i = 0;
        for (Object value : values) {
            Array.set(array, i++, convert(value, componentType));
        }
        return array;
    }

    private static Class<?> box(Class<?> type) {
        return type.isPrimitive() ? BOXES.get(type) : type;
    }
}
