package com.fxledger.settlement;

import com.fxledger.config.SettlementConfig;
import com.fxledger.coverage.CoverageResult;
import com.fxledger.coverage.PriorPeriodLotSource;
import com.fxledger.coverage.ShortCoverageResolver;
import com.fxledger.domain.model.BalanceCheck;
import com.fxledger.domain.model.ClosedPosition;
import com.fxledger.domain.model.PositionSummary;
import com.fxledger.domain.model.SettledTrade;
import com.fxledger.domain.model.SettlementReport;
import com.fxledger.domain.model.SettlementRequest;
import com.fxledger.domain.model.Trade;
import com.fxledger.exception.BaseException;
import com.fxledger.ingest.TradeNormalizer;
import com.fxledger.position.ClosedPositionResolver;
import com.fxledger.position.PositionAggregator;
import com.fxledger.rates.RateTable;
import com.fxledger.rates.RateTableLoader;
import com.fxledger.reconciliation.ReconciliationChecker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one settlement run end to end.
 *
 * <p>Flow:
 * <ol>
 *   <li>Load the rate table, normalize and settle the current-period trades, aggregate positions.</li>
 *   <li>Reconcile positions against the declared balances.</li>
 *   <li>If a ticker is oversold or fails reconciliation and prior-period tables were supplied,
 *       borrow purchase lots for the oversold tickers, settle them and re-aggregate over the union.</li>
 *   <li>Resolve closed positions and reconcile the final positions.</li>
 * </ol>
 *
 * <p>Every run owns its own {@link SettlementDiagnostics}; the pipeline keeps no state between runs.
 */
@Service
public class SettlementPipeline {

    private static final Logger log = LoggerFactory.getLogger(SettlementPipeline.class);

    private static final Comparator<SettledTrade> BY_SETTLEMENT_DATE =
            Comparator.comparing(s -> s.getTrade().getSettlementDate());

    private final SettlementConfig settlementConfig;
    private final RateTableLoader rateTableLoader;
    private final TradeNormalizer tradeNormalizer;
    private final SettlementCalculator settlementCalculator;
    private final PositionAggregator positionAggregator;
    private final ReconciliationChecker reconciliationChecker;
    private final PriorPeriodLotSource priorPeriodLotSource;
    private final ShortCoverageResolver shortCoverageResolver;
    private final ClosedPositionResolver closedPositionResolver;

    public SettlementPipeline(
            SettlementConfig settlementConfig,
            RateTableLoader rateTableLoader,
            TradeNormalizer tradeNormalizer,
            SettlementCalculator settlementCalculator,
            PositionAggregator positionAggregator,
            ReconciliationChecker reconciliationChecker,
            PriorPeriodLotSource priorPeriodLotSource,
            ShortCoverageResolver shortCoverageResolver,
            ClosedPositionResolver closedPositionResolver) {
        this.settlementConfig = settlementConfig;
        this.rateTableLoader = rateTableLoader;
        this.tradeNormalizer = tradeNormalizer;
        this.settlementCalculator = settlementCalculator;
        this.positionAggregator = positionAggregator;
        this.reconciliationChecker = reconciliationChecker;
        this.priorPeriodLotSource = priorPeriodLotSource;
        this.shortCoverageResolver = shortCoverageResolver;
        this.closedPositionResolver = closedPositionResolver;
    }

    public SettlementReport run(SettlementRequest request) {
        SettlementDiagnostics diagnostics = new SettlementDiagnostics();
        try {
            return execute(request, diagnostics);
        } catch (BaseException e) {
            log.error("Settlement run aborted [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private SettlementReport execute(SettlementRequest request, SettlementDiagnostics diagnostics) {
        RateTable rateTable = rateTableLoader.load(request.getRates(), diagnostics);
        List<Trade> trades = tradeNormalizer.normalize(request.getTrades(), diagnostics);

        List<SettledTrade> settled = settlementCalculator.settleAll(trades, rateTable, diagnostics);
        List<PositionSummary> positions = positionAggregator.aggregate(settled);
        List<BalanceCheck> initialChecks =
                reconciliationChecker.insufficient(positions, request.getDeclaredBalances());

        List<PositionSummary> oversold =
                positions.stream().filter(PositionSummary::isOversold).toList();
        CoverageResult coverage = CoverageResult.empty();

        if (!oversold.isEmpty() || !initialChecks.isEmpty()) {
            if (request.getPriorPeriods().isEmpty()) {
                oversold.forEach(p -> log.warn(
                        "{} is oversold by {} units and no prior-period report was supplied",
                        p.getTicker(),
                        -p.getSignedBalance()));
            } else if (!oversold.isEmpty()) {
                List<Trade> lots = priorPeriodLotSource.collect(request.getPriorPeriods(), diagnostics);
                coverage = shortCoverageResolver.resolve(oversold, lots, diagnostics);
            }
        }

        if (coverage.hasBorrowedTrades()) {
            List<SettledTrade> borrowed =
                    settlementCalculator.resettle(coverage.getBorrowedTrades(), rateTable, diagnostics);
            List<SettledTrade> union = new ArrayList<>(settled.size() + borrowed.size());
            union.addAll(settled);
            union.addAll(borrowed);
            union.sort(BY_SETTLEMENT_DATE);
            settled = List.copyOf(union);
            positions = positionAggregator.aggregate(settled);
        }

        List<ClosedPosition> closedPositions = closedPositionResolver.resolve(settled, positions);
        List<BalanceCheck> insufficientData =
                reconciliationChecker.insufficient(positions, request.getDeclaredBalances());

        SettlementReport report = SettlementReport.builder()
                .tradingCurrency(settlementConfig.getTradingCurrency())
                .domesticCurrency(settlementConfig.getDomesticCurrency())
                .settledTrades(List.copyOf(settled))
                .positions(positions)
                .closedPositions(closedPositions)
                .insufficientData(insufficientData)
                .uncoveredShortfalls(coverage.getUncovered())
                .diagnostics(diagnostics.snapshot())
                .build();

        log.info(
                "Settlement run complete: trades={}, borrowed={}, positions={}, closed={}, insufficient={},"
                        + " diagnostics={}",
                settled.size(),
                report.getBorrowedTradeCount(),
                positions.size(),
                Math.max(closedPositions.size() - 1, 0),
                insufficientData.size(),
                report.getDiagnostics().size());
        return report;
    }
}
