package com.fxledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** One day's official rate: units of domestic currency per unit of trading currency. */
@Value
public class RateEntry {

    LocalDate date;
    BigDecimal rate;

    public static RateEntry of(LocalDate date, BigDecimal rate) {
        return new RateEntry(date, rate);
    }
}
