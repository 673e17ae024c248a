package com.fxledger.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fxledger.ingest.DecimalCoercion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DecimalCoercionTest {

    @Test
    @DisplayName("Plain dot decimal is parsed exactly")
    void dotDecimal() {
        assertThat(DecimalCoercion.parse("1234.56")).isEqualByComparingTo("1234.56");
    }

    @Test
    @DisplayName("Comma decimal with non-breaking-space grouping")
    void commaDecimalWithGrouping() {
        assertThat(DecimalCoercion.parse("1 234,56")).isEqualByComparingTo("1234.56");
        assertThat(DecimalCoercion.parse(" 92,5000 ")).isEqualByComparingTo("92.5");
    }

    @Test
    @DisplayName("Scale of the input is preserved")
    void scalePreserved() {
        assertThat(DecimalCoercion.parse("0.10").scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Null and blank text give null")
    void blankIsNull() {
        assertThat(DecimalCoercion.parse(null)).isNull();
        assertThat(DecimalCoercion.parse("   ")).isNull();
    }

    @Test
    @DisplayName("Text that is not a number is rejected")
    void garbageRejected() {
        assertThatThrownBy(() -> DecimalCoercion.parse("n/a"))
                .isInstanceOf(NumberFormatException.class)
                .hasMessageContaining("n/a");
        assertThatThrownBy(() -> DecimalCoercion.parse("1,234.56")).isInstanceOf(NumberFormatException.class);
    }
}
