package com.fxledger.position;

import com.fxledger.domain.model.PositionSummary;
import com.fxledger.domain.model.SettledTrade;
import com.fxledger.settlement.MoneyRounding;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/**
 * Groups settled trades by ticker into a signed quantity balance and a cumulative result.
 *
 * <p>signedBalance = sum of +quantity for BUY and -quantity for everything else, UNRESOLVED
 * included. realizedResult is the exact sum of netResult rounded once to 2 places.
 * Output is sorted by ticker.
 */
@Service
public class PositionAggregator {

    public List<PositionSummary> aggregate(List<SettledTrade> settledTrades) {
        Map<String, long[]> balances = new TreeMap<>();
        Map<String, BigDecimal> results = new TreeMap<>();

        for (SettledTrade settled : settledTrades) {
            String ticker = settled.getTicker();
            balances.computeIfAbsent(ticker, t -> new long[1])[0] += settled.getTrade().signedQuantity();
            results.merge(ticker, settled.getNetResult(), BigDecimal::add);
        }

        List<PositionSummary> summaries = new ArrayList<>(balances.size());
        for (Map.Entry<String, long[]> entry : balances.entrySet()) {
            summaries.add(PositionSummary.builder()
                    .ticker(entry.getKey())
                    .signedBalance(entry.getValue()[0])
                    .realizedResult(MoneyRounding.round2(results.get(entry.getKey())))
                    .build());
        }
        return summaries;
    }
}
