package com.fxledger.settlement;

import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.enums.OperationType;
import com.fxledger.domain.model.SettledTrade;
import com.fxledger.domain.model.Trade;
import com.fxledger.rates.RateTable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Converts trades into domestic-currency results at the rate in force on their settlement date.
 *
 * <p>Formulas, each rounded half-up to 2 places independently:
 * <pre>
 *   rubAmount     = round2(amount * rate), negated for BUY
 *   rubCommission = round2(commission * rate)
 *   netResult     = round2(rubAmount - rubCommission)
 * </pre>
 * Rounding happens at every step, not once at the end, and results must match that to the kopeck.
 *
 * <p>A trade settling before the first rate in the table is settled at rate zero, flagged with
 * {@code rateFallback} and reported as a NO_RATE_FOUND diagnostic.
 */
@Service
public class SettlementCalculator {

    private static final Logger log = LoggerFactory.getLogger(SettlementCalculator.class);

    private static final Comparator<Trade> BY_SETTLEMENT_DATE = Comparator.comparing(Trade::getSettlementDate);

    public SettledTrade settle(Trade trade, BigDecimal rate) {
        BigDecimal amount = MoneyRounding.round2(trade.getAmount().multiply(rate));
        BigDecimal rubAmount = trade.getOperation() == OperationType.BUY ? amount.negate() : amount;
        BigDecimal rubCommission = MoneyRounding.round2(trade.getCommission().multiply(rate));
        BigDecimal netResult = MoneyRounding.round2(rubAmount.subtract(rubCommission));

        return SettledTrade.builder()
                .trade(trade.toBuilder().appliedRate(rate).build())
                .rubAmount(rubAmount)
                .rubCommission(rubCommission)
                .netResult(netResult)
                .build();
    }

    /**
     * Settles a batch with one forward merge over trades and rates.
     *
     * @return settled trades ordered by settlement date; equal dates keep their input order
     */
    public List<SettledTrade> settleAll(List<Trade> trades, RateTable rateTable, SettlementDiagnostics diagnostics) {
        List<Trade> ordered = new ArrayList<>(trades);
        ordered.sort(BY_SETTLEMENT_DATE);

        List<LocalDate> dates = ordered.stream().map(Trade::getSettlementDate).toList();
        List<BigDecimal> rates = rateTable.resolveAsOf(dates);

        List<SettledTrade> settled = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            settled.add(settleOrFallback(ordered.get(i), Optional.ofNullable(rates.get(i)), diagnostics));
        }
        log.info("Settled {} trades against {} rate dates", settled.size(), rateTable.size());
        return settled;
    }

    /**
     * Settles trades that were created without a rate (borrowed prior-period lots), looking each
     * one up individually. Trades already carrying a rate are settled at that rate.
     */
    public List<SettledTrade> resettle(List<Trade> trades, RateTable rateTable, SettlementDiagnostics diagnostics) {
        List<SettledTrade> settled = new ArrayList<>(trades.size());
        for (Trade trade : trades) {
            Optional<BigDecimal> rate = trade.getAppliedRate() != null
                    ? Optional.of(trade.getAppliedRate())
                    : rateTable.lookup(trade.getSettlementDate());
            settled.add(settleOrFallback(trade, rate, diagnostics));
        }
        return settled;
    }

    private SettledTrade settleOrFallback(Trade trade, Optional<BigDecimal> rate, SettlementDiagnostics diagnostics) {
        if (rate.isPresent()) {
            return settle(trade, rate.get());
        }
        log.warn(
                "No rate on or before {} for {} {} x{}; settling at rate 0",
                trade.getSettlementDate(),
                trade.getOperation(),
                trade.getTicker(),
                trade.getQuantity());
        diagnostics.record(
                DiagnosticType.NO_RATE_FOUND,
                trade.getTicker(),
                "No rate on or before " + trade.getSettlementDate() + "; domestic amounts set to zero");
        return settle(trade, BigDecimal.ZERO).toBuilder().rateFallback(true).build();
    }
}
