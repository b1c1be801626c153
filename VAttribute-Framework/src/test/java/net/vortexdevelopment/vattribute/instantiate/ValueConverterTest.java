package net.vortexdevelopment.vattribute.instantiate;

import net.vortexdevelopment.vattribute.model.ComponentKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueConverterTest {

    private final ValueConverter converter = new ValueConverter();

    @Test
    void matchingValuesPassThrough() {
        Object value = List.of("a");

        assertThat(converter.convert(value, List.class)).isSameAs(value);
        assertThat(converter.convert(5, int.class)).isEqualTo(5);
        assertThat(converter.convert(null, String.class)).isNull();
    }

    @Test
    void stringsAreParsed() {
        assertThat(converter.convert(" 42 ", int.class)).isEqualTo(42);
        assertThat(converter.convert("7", long.class)).isEqualTo(7L);
        assertThat(converter.convert("true", boolean.class)).isEqualTo(true);
        assertThat(converter.convert("1.5", double.class)).isEqualTo(1.5d);
        assertThat(converter.convert("x", char.class)).isEqualTo('x');
        assertThat(converter.convert("METHOD", ComponentKind.class)).isEqualTo(ComponentKind.METHOD);
        assertThat(converter.convert("java.lang.String", Class.class)).isEqualTo(String.class);
    }

    @Test
    void numbersAreWidenedAndRangeChecked() {
        assertThat(converter.convert(3, long.class)).isEqualTo(3L);
        assertThat(converter.convert(3L, int.class)).isEqualTo(3);
        assertThat(converter.convert(100, byte.class)).isEqualTo((byte) 100);
        assertThat(converter.convert(12, String.class)).isEqualTo("12");

        assertThatThrownBy(() -> converter.convert(300, byte.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert(Long.MAX_VALUE, int.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert(1.5d, int.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void floatingPointValuesAreNotTruncatedOrOverflowed() {
        assertThat(converter.convert(3, double.class)).isEqualTo(3.0d);
        assertThat(converter.convert(2.5d, float.class)).isEqualTo(2.5f);
        assertThat(converter.convert(Double.POSITIVE_INFINITY, float.class)).isEqualTo(Float.POSITIVE_INFINITY);

        assertThatThrownBy(() -> converter.convert(3.7d, long.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert(3.0f, Long.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert(1e300, float.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert(-1e300, Float.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void collectionsAndArraysConvert() {
        int[] numbers = (int[]) converter.convert(List.of(1, "2", 3L), int[].class);
        assertThat(numbers).containsExactly(1, 2, 3);

        assertThat(converter.convert(new String[]{"a", "b"}, List.class)).isEqualTo(List.of("a", "b"));
    }

    @Test
    void impossibleConversionsFail() {
        assertThatThrownBy(() -> converter.convert(null, int.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("primitive");
        assertThatThrownBy(() -> converter.convert("abc", int.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert("NOPE", ComponentKind.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert("no.such.Type", Class.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown class");
        assertThatThrownBy(() -> converter.convert(new Object(), String.class)).isInstanceOf(IllegalArgumentException.class);
    }
}
