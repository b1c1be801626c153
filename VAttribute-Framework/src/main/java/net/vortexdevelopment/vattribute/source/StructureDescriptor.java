package net.vortexdevelopment.vattribute.source;

import lombok.Getter;
import net.vortexdevelopment.vattribute.model.AttachedMarker;
import net.vortexdevelopment.vattribute.model.ComponentDescriptor;
import net.vortexdevelopment.vattribute.model.ComponentKind;
import net.vortexdevelopment.vattribute.model.MarkerArguments;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Schema-style description of one structure for {@link DescriptorStructureSource}.
 *
 * <pre>
 * {@code
 * StructureDescriptor.builder("app.Point")
 *         .parent("app.Shape")
 *         .marker(Table.class, MarkerArguments.named(Map.of("name", "points")))
 *         .property("x", "int", p -> p.marker(Column.class))
 *         .method("move", "void", m -> m.parameter("dx", "int"))
 *         .build();
 * }
 * </pre>
 */
@Getter
public class StructureDescriptor {

    private final String name;
    private final boolean contract;
    @Nullable
    private final String parent;
    private final List<String> contracts;
    private final List<AttachedMarker> markers;
    private final Map<ComponentKind, Map<String, Member>> members;

    private StructureDescriptor(Builder builder) {
        this.name = builder.name;
        this.contract = builder.contract;
        this.parent = builder.parent;
        this.contracts = List.copyOf(builder.contracts);
        this.markers = List.copyOf(builder.markers);
        Map<ComponentKind, Map<String, Member>> copy = new EnumMap<>(ComponentKind.class);
        builder.members.forEach((kind, byName) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.members = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name, false);
    }

    public static Builder contractBuilder(String name) {
        return new Builder(name, true);
    }

    public Map<String, Member> members(ComponentKind kind) {
        return members.getOrDefault(kind, Map.of());
    }

    /**
     * A property, method, constant or parameter together with its markers.
     */
    @Getter
    public static class Member {
        private final ComponentDescriptor descriptor;
        private final List<AttachedMarker> markers;
        private final Map<String, Member> parameters;

        private Member(MemberBuilder builder) {
            this.descriptor = builder.descriptor;
            this.markers = List.copyOf(builder.markers);
            this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        }
    }

    public static class MemberBuilder {
        private final ComponentDescriptor descriptor;
        private final List<AttachedMarker> markers = new ArrayList<>();
        private final Map<String, Member> parameters = new LinkedHashMap<>();

        private MemberBuilder(ComponentDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        public MemberBuilder marker(Class<?> type) {
            return marker(type, MarkerArguments.none());
        }

        public MemberBuilder marker(Class<?> type, MarkerArguments arguments) {
            markers.add(AttachedMarker.of(type, arguments));
            return this;
        }

        public MemberBuilder parameter(String name, @Nullable String type) {
            return parameter(name, type, p -> { });
        }

        public MemberBuilder parameter(String name, @Nullable String type, Consumer<MemberBuilder> configurer) {
            if (descriptor.kind() != ComponentKind.METHOD) {
                throw new IllegalStateException("Only methods have parameters, " + descriptor.name() + " is a " + descriptor.kind());
            }
            MemberBuilder parameter = new MemberBuilder(ComponentDescriptor.parameter(name, type, parameters.size()));
            configurer.accept(parameter);
            if (parameters.putIfAbsent(name, new Member(parameter)) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + name + " on " + descriptor.name());
            }
            return this;
        }
    }

    public static class Builder {
        private final String name;
        private final boolean contract;
        private String parent;
        private final List<String> contracts = new ArrayList<>();
        private final List<AttachedMarker> markers = new ArrayList<>();
        private final Map<ComponentKind, Map<String, Member>> members = new EnumMap<>(ComponentKind.class);

        private Builder(String name, boolean contract) {
            this.name = name;
            this.contract = contract;
        }

        public Builder parent(String parent) {
            if (contract) {
                throw new IllegalStateException("Contract " + name + " cannot have a parent class; use implement()");
            }
            this.parent = parent;
            return this;
        }

        /**
         * Implemented contracts for classes, extended contracts for contracts.
         */
        public Builder implement(String... contracts) {
            this.contracts.addAll(List.of(contracts));
            return this;
        }

        public Builder marker(Class<?> type) {
            return marker(type, MarkerArguments.none());
        }

        public Builder marker(Class<?> type, MarkerArguments arguments) {
            markers.add(AttachedMarker.of(type, arguments));
            return this;
        }

        public Builder property(String name, @Nullable String type) {
            return property(name, type, false, m -> { });
        }

        public Builder property(String name, @Nullable String type, Consumer<MemberBuilder> configurer) {
            return property(name, type, false, configurer);
        }

        public Builder property(String name, @Nullable String type, boolean isStatic, Consumer<MemberBuilder> configurer) {
            return member(ComponentDescriptor.of(name, ComponentKind.PROPERTY, type, isStatic), configurer);
        }

        public Builder method(String name, @Nullable String returnType, Consumer<MemberBuilder> configurer) {
            return method(name, returnType, false, configurer);
        }

        public Builder method(String name, @Nullable String returnType, boolean isStatic, Consumer<MemberBuilder> configurer) {
            return member(ComponentDescriptor.of(name, ComponentKind.METHOD, returnType, isStatic), configurer);
        }

        public Builder constant(String name, @Nullable String type, Consumer<MemberBuilder> configurer) {
            return member(ComponentDescriptor.of(name, ComponentKind.CONSTANT, type, true), configurer);
        }

        private Builder member(ComponentDescriptor descriptor, Consumer<MemberBuilder> configurer) {
            if (contract && descriptor.kind() == ComponentKind.PROPERTY) {
                throw new IllegalStateException("Contract " + name + " cannot declare property " + descriptor.name());
            }
            MemberBuilder member = new MemberBuilder(descriptor);
            configurer.accept(member);
            Map<String, Member> byName = members.computeIfAbsent(descriptor.kind(), kind -> new LinkedHashMap<>());
            if (byName.putIfAbsent(descriptor.name(), new Member(member)) != null) {
                throw new IllegalArgumentException("Duplicate " + descriptor.kind() + " " + descriptor.name() + " on " + name);
            }
            return this;
        }

        public StructureDescriptor build() {
            return new StructureDescriptor(this);
        }
    }
}
