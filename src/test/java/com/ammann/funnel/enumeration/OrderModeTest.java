/* (C)2026 */
package com.ammann.funnel.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OrderModeTest {

    @Test
    void enumHasThreeValues() {
        assertThat(OrderMode.values())
                .containsExactly(OrderMode.STRICT, OrderMode.ORDERED, OrderMode.UNORDERED);
    }

    @ParameterizedTest
    @CsvSource({
            "strict, STRICT",
            "Ordered, ORDERED",
            "UNORDERED, UNORDERED"
    })
    void fromStringIsCaseInsensitive(String value, OrderMode expected) {
        assertThat(OrderMode.fromString(value)).isEqualTo(expected);
    }

    @Test
    void fromStringRejectsUnknownAndNull() {
        assertThatThrownBy(() -> OrderMode.fromString("sequential"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STRICT, ORDERED or UNORDERED");
        assertThatThrownBy(() -> OrderMode.fromString(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null");
    }
}
