package net.vortexdevelopment.vattribute.model;

import org.jetbrains.annotations.NotNull;

/**
 * A marker as found on a target: its concrete class and the raw arguments it was declared with.
 */
public record AttachedMarker(@NotNull Class<?> type, @NotNull MarkerArguments arguments) {

    public static AttachedMarker of(Class<?> type) {
        return new AttachedMarker(type, MarkerArguments.none());
    }

    public static AttachedMarker of(Class<?> type, MarkerArguments arguments) {
        return new AttachedMarker(type, arguments);
    }
}
