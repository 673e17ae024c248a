package com.fxledger.settlement;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/** Monetary rounding shared by every stage: 2 fractional digits, half-up. */
public final class MoneyRounding {

    /** Precision for intermediate division (34 significant digits). */
    public static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL128;

    private MoneyRounding() {}

    public static BigDecimal round2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    /** Exact sum of {@code values}, rounded once at the end. */
    public static BigDecimal sumRounded(Collection<BigDecimal> values) {
        return round2(values.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /** {@code value * part / whole}, rounded to 2 places. */
    public static BigDecimal prorate(BigDecimal value, long part, long whole) {
        return round2(value.multiply(BigDecimal.valueOf(part)).divide(BigDecimal.valueOf(whole), DIVISION_CONTEXT));
    }
}
