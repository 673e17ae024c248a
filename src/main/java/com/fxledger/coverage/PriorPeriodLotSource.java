package com.fxledger.coverage;

import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.model.RawTable;
import com.fxledger.domain.model.Trade;
import com.fxledger.exception.BaseException;
import com.fxledger.exception.EmptyInputException;
import com.fxledger.exception.SchemaException;
import com.fxledger.ingest.TradeNormalizer;
import com.fxledger.settlement.SettlementDiagnostics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Flattens prior-period trade tables into purchase lots for {@link ShortCoverageResolver}.
 *
 * <p>Each table goes through the same {@link TradeNormalizer} as the current period. Only rows
 * whose operation label matches the lot lexicon are kept. Lots are ordered most recent first
 * (trade date, then settlement date, both descending); equal dates keep table order.
 *
 * <p>A prior table that cannot be read is skipped rather than aborting the run.
 */
@Service
public class PriorPeriodLotSource {

    private static final Logger log = LoggerFactory.getLogger(PriorPeriodLotSource.class);

    static final Comparator<Trade> MOST_RECENT_FIRST = Comparator.comparing(Trade::getTradeDate)
            .thenComparing(Trade::getSettlementDate)
            .reversed();

    private final TradeNormalizer tradeNormalizer;

    public PriorPeriodLotSource(TradeNormalizer tradeNormalizer) {
        this.tradeNormalizer = tradeNormalizer;
    }

    public List<Trade> collect(List<RawTable> tables, SettlementDiagnostics diagnostics) {
        List<Trade> lots = new ArrayList<>();
        for (int i = 0; i < tables.size(); i++) {
            String source = "prior-period #" + (i + 1);
            List<Trade> trades;
            try {
                trades = tradeNormalizer.normalize(tables.get(i), source, diagnostics);
            } catch (SchemaException | EmptyInputException e) {
                skipTable(source, e, diagnostics);
                continue;
            }
            int kept = 0;
            for (Trade trade : trades) {
                if (tradeNormalizer.isLotLabel(trade.getOperationLabel())) {
                    lots.add(trade);
                    kept++;
                }
            }
            log.info("{}: {} of {} rows usable as purchase lots", source, kept, trades.size());
        }
        lots.sort(MOST_RECENT_FIRST);
        return List.copyOf(lots);
    }

    private void skipTable(String source, BaseException e, SettlementDiagnostics diagnostics) {
        log.warn("Skipping {} table: {}", source, e.getMessage());
        diagnostics.record(DiagnosticType.PRIOR_TABLE_SKIPPED, null, source + ": " + e.getMessage());
    }
}
