package net.vortexdevelopment.vattribute.capability;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Binding table from sub-marker type to the handler that receives it.
 *
 * <pre>
 * {@code
 * @Override
 * public SubMarkers subMarkers() {
 *     return SubMarkers.builder()
 *             .single(Description.class, this::fromDescription)
 *             .multiple(Tag.class, this::fromTags)
 *             .build();
 * }
 * }
 * </pre>
 */
public final class SubMarkers {

    @Getter
    private final List<Binding<?>> bindings;

    private SubMarkers(List<Binding<?>> bindings) {
        this.bindings = bindings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Binding<?>> bindings = new ArrayList<>();

        /**
         * Bind a single-valued sub-marker. The handler receives null when none is attached.
         */
        public <S> Builder single(Class<S> type, Consumer<? super S> handler) {
            bindings.add(new Binding<>(type, false, handler, null));
            return this;
        }

        /**
         * Bind a {@link Multivalue} sub-marker. The handler always receives a list, possibly empty.
         */
        public <S> Builder multiple(Class<S> type, Consumer<? super List<S>> handler) {
            bindings.add(new Binding<>(type, true, null, handler));
            return this;
        }

        public SubMarkers build() {
            return new SubMarkers(Collections.unmodifiableList(new ArrayList<>(bindings)));
        }
    }

    /**
     * One sub-marker type together with its handler.
     */
    public static final class Binding<S> {
        @Getter
        private final Class<S> type;
        @Getter
        private final boolean multiple;
        private final Consumer<? super S> singleHandler;
        private final Consumer<? super List<S>> listHandler;

        private Binding(Class<S> type, boolean multiple, @Nullable Consumer<? super S> singleHandler,
                        @Nullable Consumer<? super List<S>> listHandler) {
            this.type = type;
            this.multiple = multiple;
            this.singleHandler = singleHandler;
            this.listHandler = listHandler;
        }

        public void accept(@Nullable Object value) {
            singleHandler.accept(type.cast(value));
        }

        public void acceptAll(List<?> values) {
            List<S> typed = new ArrayList<>(values.size());
            for (Object value : values) {
                typed.add(type.cast(value));
            }
            listHandler.accept(Collections.unmodifiableList(typed));
        }
    }
}
