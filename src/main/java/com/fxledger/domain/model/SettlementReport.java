package com.fxledger.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Output tables of one settlement run.
 *
 * <p>settledTrades holds one row per original and borrowed trade in settlement-date order.
 * closedPositions ends with the synthetic total row when it has any rows at all.
 */
@Value
@Builder
public class SettlementReport {

    String tradingCurrency;
    String domesticCurrency;
    List<SettledTrade> settledTrades;
    List<PositionSummary> positions;
    List<ClosedPosition> closedPositions;
    List<BalanceCheck> insufficientData;
    List<UncoveredShortfall> uncoveredShortfalls;
    List<SettlementDiagnostic> diagnostics;

    public int getBorrowedTradeCount() {
        return (int) settledTrades.stream().filter(s -> s.getTrade().isBorrowed()).count();
    }
}
