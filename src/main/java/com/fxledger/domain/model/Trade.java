package com.fxledger.domain.model;

import com.fxledger.domain.enums.OperationType;
import com.fxledger.domain.enums.TradeOrigin;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized broker trade in the trading currency.
 *
 * <p>Quantity, amount and commission are magnitudes; the direction lives only in
 * {@link #operation}. {@link #operationLabel} keeps the broker's original wording for reports.
 * {@link #appliedRate} is null until the trade is settled; borrowed prior-period trades are
 * created without it and settled in a second pass.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    String ticker;
    OperationType operation;
    String operationLabel;
    int quantity;
    BigDecimal price;
    String currency;
    BigDecimal amount;
    BigDecimal commission;
    String commissionCurrency;
    LocalDate tradeDate;
    LocalDate settlementDate;
    BigDecimal appliedRate;

    @Builder.Default
    TradeOrigin origin = TradeOrigin.CURRENT_PERIOD;

    public long signedQuantity() {
        return operation.signedQuantity(quantity);
    }

    public boolean isBorrowed() {
        return origin == TradeOrigin.PRIOR_PERIOD;
    }
}
