package com.fxledger.coverage;

import com.fxledger.config.SettlementConfig;
import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.enums.OperationType;
import com.fxledger.domain.enums.TradeOrigin;
import com.fxledger.domain.model.PositionSummary;
import com.fxledger.domain.model.Trade;
import com.fxledger.domain.model.UncoveredShortfall;
import com.fxledger.settlement.MoneyRounding;
import com.fxledger.settlement.SettlementDiagnostics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Covers oversold tickers by borrowing purchase lots from prior-period history.
 *
 * <p>For a ticker with balance -N the resolver walks that ticker's lots in the order given (most
 * recent first, as supplied by {@link PriorPeriodLotSource}) and takes
 * {@code min(lot quantity, N - consumed)} from each until N units are covered or the lots run
 * out. Each take becomes a BUY trade labelled with the configured borrowed-operation label whose
 * amount and commission are the lot's values prorated by {@code taken / lot quantity}. Borrowed
 * trades carry no rate; the pipeline settles them afterwards.
 *
 * <p>Most-recent-first is not FIFO tax-lot order. Which convention the tax filing expects is
 * still open, so the order is kept as is.
 *
 * <p>Running out of lots is not an error: the residual is logged, reported as an
 * {@link UncoveredShortfall} and the ticker stays open.
 */
@Service
public class ShortCoverageResolver {

    private static final Logger log = LoggerFactory.getLogger(ShortCoverageResolver.class);

    private final SettlementConfig settlementConfig;

    public ShortCoverageResolver(SettlementConfig settlementConfig) {
        this.settlementConfig = settlementConfig;
    }

    public CoverageResult resolve(
            List<PositionSummary> positions, List<Trade> lots, SettlementDiagnostics diagnostics) {
        Map<String, List<Trade>> lotsByTicker = lots.stream().collect(Collectors.groupingBy(Trade::getTicker));

        List<Trade> borrowed = new ArrayList<>();
        List<UncoveredShortfall> uncovered = new ArrayList<>();

        for (PositionSummary position : positions) {
            if (!position.isOversold()) {
                continue;
            }
            long shortfall = -position.getSignedBalance();
            TickerCoverage coverage =
                    coverTicker(position.getTicker(), shortfall, lotsByTicker.getOrDefault(position.getTicker(), List.of()));
            borrowed.addAll(coverage.getBorrowedTrades());

            if (!coverage.isFullyCovered()) {
                log.warn(
                        "Ticker {} remains oversold: shortfall={}, covered={}, residual={}",
                        coverage.getTicker(),
                        shortfall,
                        coverage.getConsumed(),
                        coverage.residual());
                diagnostics.record(
                        DiagnosticType.INSUFFICIENT_PRIOR_DATA,
                        coverage.getTicker(),
                        "Prior-period lots cover " + coverage.getConsumed() + " of " + shortfall + " units");
                uncovered.add(UncoveredShortfall.builder()
                        .ticker(coverage.getTicker())
                        .shortfall(shortfall)
                        .covered(coverage.getConsumed())
                        .residual(coverage.residual())
                        .build());
            }
        }

        if (!borrowed.isEmpty()) {
            log.info("Borrowed {} prior-period lots; {} tickers left uncovered", borrowed.size(), uncovered.size());
        }
        return CoverageResult.builder()
                .borrowedTrades(List.copyOf(borrowed))
                .uncovered(List.copyOf(uncovered))
                .build();
    }

    /**
     * Consumes {@code lots} in order until {@code shortfall} units are covered.
     *
     * @param lots purchase lots of {@code ticker}, already in consumption order
     */
    public TickerCoverage coverTicker(String ticker, long shortfall, List<Trade> lots) {
        log.info("Covering {}: shortfall={}, candidate lots={}", ticker, shortfall, lots.size());
        List<Trade> borrowed = new ArrayList<>();
        long consumed = 0;

        for (Trade lot : lots) {
            if (consumed >= shortfall) {
                break;
            }
            if (lot.getQuantity() <= 0) {
                continue;
            }
            int take = (int) Math.min(lot.getQuantity(), shortfall - consumed);
            borrowed.add(borrowFrom(lot, take));
            consumed += take;
            log.info(
                    "Covered {} of {} from lot {} (qty={}, price={})",
                    take,
                    ticker,
                    lot.getTradeDate(),
                    lot.getQuantity(),
                    lot.getPrice());
        }
        return new TickerCoverage(ticker, shortfall, consumed, List.copyOf(borrowed));
    }

    private Trade borrowFrom(Trade lot, int take) {
        return Trade.builder()
                .ticker(lot.getTicker())
                .operation(OperationType.BUY)
                .operationLabel(settlementConfig.getBorrowedOperationLabel())
                .quantity(take)
                .price(lot.getPrice())
                .currency(lot.getCurrency())
                .amount(MoneyRounding.prorate(lot.getAmount(), take, lot.getQuantity()))
                .commission(MoneyRounding.prorate(lot.getCommission(), take, lot.getQuantity()))
                .commissionCurrency(lot.getCommissionCurrency())
                .tradeDate(lot.getTradeDate())
                .settlementDate(lot.getSettlementDate())
                .appliedRate(null)
                .origin(TradeOrigin.PRIOR_PERIOD)
                .build();
    }
}
