package com.fxledger.position;

import com.fxledger.config.SettlementConfig;
import com.fxledger.domain.enums.OperationType;
import com.fxledger.domain.model.ClosedPosition;
import com.fxledger.domain.model.PositionSummary;
import com.fxledger.domain.model.SettledTrade;
import com.fxledger.settlement.MoneyRounding;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the closed-position table: one row per ticker whose balance is exactly zero, followed by
 * a total row when at least one ticker closed.
 *
 * <p>Per ticker:
 * <ul>
 *   <li>totalBuys = -(sum of rubAmount over BUY trades, borrowed lots included)</li>
 *   <li>totalSells = sum of rubAmount over SELL trades</li>
 *   <li>totalCommission = sum of rubCommission over all trades of the ticker</li>
 *   <li>netResult = totalSells - totalBuys - totalCommission</li>
 * </ul>
 * Each figure is summed exactly and then rounded to 2 places. The total row sums each column over
 * the ticker rows and rounds again.
 *
 * <p>Buys are selected by {@link OperationType#BUY}, not by the broker's literal purchase label, so
 * lots borrowed from a prior period count toward totalBuys. Matching the label instead would close
 * a covered ticker with no cost basis while still charging the borrowed lots' commission.
 */
@Service
public class ClosedPositionResolver {

    private static final Logger log = LoggerFactory.getLogger(ClosedPositionResolver.class);

    private final SettlementConfig settlementConfig;

    public ClosedPositionResolver(SettlementConfig settlementConfig) {
        this.settlementConfig = settlementConfig;
    }

    public List<ClosedPosition> resolve(List<SettledTrade> settledTrades, List<PositionSummary> positions) {
        Map<String, List<SettledTrade>> byTicker =
                settledTrades.stream().collect(Collectors.groupingBy(SettledTrade::getTicker));

        List<ClosedPosition> rows = new ArrayList<>();
        for (PositionSummary position : positions) {
            if (!position.isClosed()) {
                continue;
            }
            rows.add(closeTicker(position.getTicker(), byTicker.getOrDefault(position.getTicker(), List.of())));
        }

        if (rows.isEmpty()) {
            log.info("No closed positions among {} tickers", positions.size());
            return List.of();
        }

        ClosedPosition total = ClosedPosition.builder()
                .ticker(settlementConfig.getTotalRowLabel())
                .totalBuys(sumColumn(rows, ClosedPosition::getTotalBuys))
                .totalSells(sumColumn(rows, ClosedPosition::getTotalSells))
                .totalCommission(sumColumn(rows, ClosedPosition::getTotalCommission))
                .netResult(sumColumn(rows, ClosedPosition::getNetResult))
                .total(true)
                .build();
        rows.add(total);

        log.info("Closed positions: {} tickers, net result {}", rows.size() - 1, total.getNetResult());
        return List.copyOf(rows);
    }

    private ClosedPosition closeTicker(String ticker, List<SettledTrade> trades) {
        BigDecimal buys = BigDecimal.ZERO;
        BigDecimal sells = BigDecimal.ZERO;
        BigDecimal commission = BigDecimal.ZERO;
        for (SettledTrade trade : trades) {
            if (trade.getOperation() == OperationType.BUY) {
                buys = buys.add(trade.getRubAmount().negate());
            } else if (trade.getOperation() == OperationType.SELL) {
                sells = sells.add(trade.getRubAmount());
            }
            commission = commission.add(trade.getRubCommission());
        }

        BigDecimal totalBuys = MoneyRounding.round2(buys);
        BigDecimal totalSells = MoneyRounding.round2(sells);
        BigDecimal totalCommission = MoneyRounding.round2(commission);
        return ClosedPosition.builder()
                .ticker(ticker)
                .totalBuys(totalBuys)
                .totalSells(totalSells)
                .totalCommission(totalCommission)
                .netResult(MoneyRounding.round2(totalSells.subtract(totalBuys).subtract(totalCommission)))
                .build();
    }

    private static BigDecimal sumColumn(
            List<ClosedPosition> rows, Function<ClosedPosition, BigDecimal> column) {
        return MoneyRounding.sumRounded(rows.stream().map(column).toList());
    }
}
