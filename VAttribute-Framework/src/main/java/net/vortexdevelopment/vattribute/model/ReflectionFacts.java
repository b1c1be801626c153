package net.vortexdevelopment.vattribute.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Structural facts handed to {@link net.vortexdevelopment.vattribute.capability.Reflectable} markers.
 * Everything here is copied out of the structure source; no live reflection handle is kept.
 */
@Getter
@Builder
@ToString
public class ReflectionFacts {

    private final ComponentKind kind;

    /**
     * Short name: the simple class name for structures, the component name otherwise.
     */
    private final String name;

    /**
     * Qualified name of the structure the target belongs to.
     */
    private final String structure;

    /**
     * Owning method, for parameters.
     */
    @Nullable
    private final String method;

    @Nullable
    private final String declaredType;

    private final boolean isStatic;

    /**
     * Whether the structure itself is a contract (interface).
     */
    private final boolean contract;

    @Builder.Default
    private final int position = -1;

    @Builder.Default
    private final List<String> ancestors = List.of();

    @Builder.Default
    private final List<String> contracts = List.of();
}
