package net.vortexdevelopment.vattribute.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Constructor-style arguments of an attached marker: positional values first, then named ones.
 */
public final class MarkerArguments {

    private static final MarkerArguments NONE = new MarkerArguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private MarkerArguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    public static MarkerArguments none() {
        return NONE;
    }

    public static MarkerArguments positional(Object... values) {
        return new MarkerArguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))), Map.of());
    }

    public static MarkerArguments named(Map<String, ?> values) {
        return new MarkerArguments(List.of(), Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Object> getPositional() {
        return positional;
    }

    public Map<String, Object> getNamed() {
        return named;
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkerArguments that)) return false;
        return positional.equals(that.positional) && named.equals(that.named);
    }

    @Override
    public int hashCode() {
        return 31 * positional.hashCode() + named.hashCode();
    }

    @Override
    public String toString() {
        return "MarkerArguments{positional=" + positional + ", named=" + named + '}';
    }

    public static class Builder {
        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();

        public Builder add(Object value) {
            if (!named.isEmpty()) {
                throw new IllegalStateException("Positional arguments must come before named arguments");
            }
            positional.add(value);
            return this;
        }

        public Builder with(String name, Object value) {
            if (named.containsKey(name)) {
                throw new IllegalArgumentException("Argument '" + name + "' given twice");
            }
            named.put(name, value);
            return this;
        }

        public MarkerArguments build() {
            if (positional.isEmpty() && named.isEmpty()) {
                return NONE;
            }
            return new MarkerArguments(Collections.unmodifiableList(new ArrayList<>(positional)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(named)));
        }
    }
}
