package com.fxledger.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Inputs of one settlement run. Prior-period tables and declared balances are optional; a ticker
 * missing from {@code declaredBalances} is treated as "no declared balance".
 */
@Value
@Builder
public class SettlementRequest {

    RawTable trades;
    RawTable rates;

    @Singular
    List<RawTable> priorPeriods;

    @Singular
    Map<String, Long> declaredBalances;
}
