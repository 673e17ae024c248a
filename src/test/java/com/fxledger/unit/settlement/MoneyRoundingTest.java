package com.fxledger.unit.settlement;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxledger.settlement.MoneyRounding;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoneyRoundingTest {

    @Test
    @DisplayName("Half-up to two places, away from zero on negatives")
    void halfUp() {
        assertThat(MoneyRounding.round2(new BigDecimal("2.345"))).isEqualTo(new BigDecimal("2.35"));
        assertThat(MoneyRounding.round2(new BigDecimal("-2.345"))).isEqualTo(new BigDecimal("-2.35"));
        assertThat(MoneyRounding.round2(new BigDecimal("7"))).isEqualTo(new BigDecimal("7.00"));
    }

    @Test
    @DisplayName("Rounding twice equals rounding once")
    void idempotent() {
        for (String value : List.of("0.005", "-0.005", "123.4449", "99999.995", "1E-7", "42")) {
            BigDecimal once = MoneyRounding.round2(new BigDecimal(value));
            assertThat(MoneyRounding.round2(once)).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("Prorating 7 of 10 units")
    void prorate() {
        assertThat(MoneyRounding.prorate(new BigDecimal("1000.00"), 7, 10)).isEqualTo(new BigDecimal("700.00"));
        assertThat(MoneyRounding.prorate(new BigDecimal("10.00"), 1, 3)).isEqualTo(new BigDecimal("3.33"));
        assertThat(MoneyRounding.prorate(new BigDecimal("5.00"), 2, 3)).isEqualTo(new BigDecimal("3.33"));
    }
}
