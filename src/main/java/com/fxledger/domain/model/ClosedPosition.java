package com.fxledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Totals for a ticker whose balance nets to zero. totalBuys is a positive magnitude.
 * One extra row with {@code total = true} carries the column sums of all closed tickers.
 */
@Value
@Builder
public class ClosedPosition {

    String ticker;
    BigDecimal totalBuys;
    BigDecimal totalSells;
    BigDecimal totalCommission;
    BigDecimal netResult;
    boolean total;
}
