package com.fxledger.coverage;

import com.fxledger.domain.model.Trade;
import com.fxledger.domain.model.UncoveredShortfall;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Borrowed trades synthesized for all oversold tickers, plus the shortfalls left uncovered. */
@Value
@Builder
public class CoverageResult {

    List<Trade> borrowedTrades;
    List<UncoveredShortfall> uncovered;

    public static CoverageResult empty() {
        return new CoverageResult(List.of(), List.of());
    }

    public boolean hasBorrowedTrades() {
        return !borrowedTrades.isEmpty();
    }
}
