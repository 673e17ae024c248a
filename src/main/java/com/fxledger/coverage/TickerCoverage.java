package com.fxledger.coverage;

import com.fxledger.domain.model.Trade;
import java.util.List;
import lombok.Value;

/** Outcome of covering one ticker: consumed never exceeds shortfall. */
@Value
public class TickerCoverage {

    String ticker;
    long shortfall;
    long consumed;
    List<Trade> borrowedTrades;

    public long residual() {
        return shortfall - consumed;
    }

    public boolean isFullyCovered() {
        return consumed >= shortfall;
    }
}
