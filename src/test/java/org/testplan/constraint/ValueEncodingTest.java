package org.testplan.constraint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueEncodingTest {

    @Test
    void encode_shouldAssignCodesFromOneInOptionOrder() {
        // Given
        ValueEncoding encoding = new ValueEncoding(4, List.of("A", "B", "C"));

        // Then
        assertThat(encoding.encode("A")).isEqualTo(1);
        assertThat(encoding.encode("C")).isEqualTo(3);
        assertThat(encoding.encode("Z")).isNull();
        assertThat(encoding.size()).isEqualTo(3);
        assertThat(encoding.getValues()).containsExactly("A", "B", "C");
    }

    @Test
    void decode_shouldInvertEncode_andReserveZero() {
        // Given
        ValueEncoding encoding = new ValueEncoding(4, List.of("A", "B"));

        // Then
        assertThat(encoding.decode(encoding.encode("B"))).isEqualTo("B");
        assertThat(encoding.decode(ValueEncoding.UNSET)).isNull();
        assertThatThrownBy(() -> encoding.decode(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_shouldRejectDuplicateValues() {
        assertThatThrownBy(() -> new ValueEncoding(1, List.of("A", "A")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicato");
    }

    @Test
    void isDynamicSource_shouldBeTrue_whenThereAreNoOptions() {
        // Given
        ValueEncoding encoding = new ValueEncoding(2, List.of());

        // Then
        assertThat(encoding.isDynamicSource()).isTrue();
        assertThat(encoding.getValues()).isEmpty();
        assertThat(new IntegerVariable(encoding).domainConstraint().isTrue()).isTrue();
    }
}
