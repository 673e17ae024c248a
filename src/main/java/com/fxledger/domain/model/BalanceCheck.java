package com.fxledger.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Computed versus declared end-of-period balance for one ticker. Either side may be null: the
 * computed side when the broker declares a ticker that never traded, the declared side when the
 * broker statement omits it.
 */
@Value
@Builder
public class BalanceCheck {

    String ticker;
    Long computedBalance;
    Long declaredBalance;
    boolean sufficient;
}
