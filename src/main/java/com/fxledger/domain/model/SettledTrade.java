package com.fxledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fxledger.domain.enums.OperationType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A trade joined to its rate, with domestic-currency results.
 *
 * <p>rubAmount is negative for buys and positive for sells; rubCommission is never negative;
 * netResult = rubAmount - rubCommission. Each of the three is rounded to 2 places on its own.
 * {@code rateFallback} is set when no rate preceded the settlement date and zero was applied.
 */
@Value
@Builder(toBuilder = true)
public class SettledTrade {

    @JsonUnwrapped
    Trade trade;

    BigDecimal rubAmount;
    BigDecimal rubCommission;
    BigDecimal netResult;
    boolean rateFallback;

    @JsonIgnore
    public String getTicker() {
        return trade.getTicker();
    }

    @JsonIgnore
    public OperationType getOperation() {
        return trade.getOperation();
    }
}
