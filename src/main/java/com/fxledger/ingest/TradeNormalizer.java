package com.fxledger.ingest;

import com.fxledger.config.SettlementConfig;
import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.enums.OperationType;
import com.fxledger.domain.model.RawTable;
import com.fxledger.domain.model.Trade;
import com.fxledger.exception.EmptyInputException;
import com.fxledger.exception.RowParseException;
import com.fxledger.exception.SchemaException;
import com.fxledger.settlement.SettlementDiagnostics;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Typed ingestion boundary for broker trade tables.
 *
 * <p>Every monetary and quantity cell is converted to an exact decimal here, exactly once, and the
 * free-text operation label is classified into {@link OperationType}. Downstream stages never look
 * at raw strings again.
 *
 * <p>Failure handling follows the table/row split:
 * <ul>
 *   <li>Empty table or missing ticker/operation column: the run aborts.</li>
 *   <li>Other missing columns: a placeholder is substituted (zero, the trading currency, or
 *       today's date) and a MISSING_COLUMN diagnostic is recorded.</li>
 *   <li>Malformed row: the row is skipped with a ROW_SKIPPED diagnostic.</li>
 * </ul>
 *
 * <p>Rows in a currency other than the configured trading currency are dropped.
 */
@Service
public class TradeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TradeNormalizer.class);

    public static final String TRADE_TABLE = "trade";

    private final SettlementConfig settlementConfig;
    private final Clock clock;

    public TradeNormalizer(SettlementConfig settlementConfig, Clock clock) {
        this.settlementConfig = settlementConfig;
        this.clock = clock;
    }

    /**
     * Classifies a raw operation label by case-insensitive substring containment. The buy lexicon
     * is checked first. Labels matching neither lexicon are UNRESOLVED.
     */
    public OperationType classify(String rawLabel) {
        String label = rawLabel == null ? "" : rawLabel.trim().toLowerCase(Locale.ROOT);
        if (containsAny(label, settlementConfig.getBuyLexicon())) {
            return OperationType.BUY;
        }
        if (containsAny(label, settlementConfig.getSellLexicon())) {
            return OperationType.SELL;
        }
        return OperationType.UNRESOLVED;
    }

    /** True if the label marks a prior-period row that can serve as a purchase lot. */
    public boolean isLotLabel(String rawLabel) {
        String label = rawLabel == null ? "" : rawLabel.trim().toLowerCase(Locale.ROOT);
        return containsAny(label, settlementConfig.getLotLexicon());
    }

    public List<Trade> normalize(RawTable table, SettlementDiagnostics diagnostics) {
        return normalize(table, TRADE_TABLE, diagnostics);
    }

    /**
     * Normalizes every row of {@code table}.
     *
     * @param source table name used in logs, diagnostics and exceptions
     * @return trades in input order, excluding skipped and foreign-currency rows
     * @throws EmptyInputException if the table has no rows
     * @throws SchemaException if the ticker or operation column is absent
     */
    public List<Trade> normalize(RawTable table, String source, SettlementDiagnostics diagnostics) {
        if (table == null || table.isEmpty()) {
            throw new EmptyInputException(source);
        }

        Map<TradeColumn, String> headers = resolveHeaders(table, source, diagnostics);
        LocalDate today = LocalDate.now(clock);
        String tradingCurrency = settlementConfig.getTradingCurrency();

        List<Trade> trades = new ArrayList<>(table.size());
        int skipped = 0;
        int foreignCurrency = 0;

        for (int i = 0; i < table.size(); i++) {
            Map<String, String> row = table.getRows().get(i);
            int rowNumber = i + 1;
            Trade trade;
            try {
                trade = parseRow(row, headers, today);
            } catch (RowParseException e) {
                skipped++;
                String ticker = trimToNull(RawTable.cell(row, headers.get(TradeColumn.TICKER)));
                log.warn("Skipping {} row {} (ticker={}): {}", source, rowNumber, ticker, e.getMessage());
                diagnostics.record(
                        DiagnosticType.ROW_SKIPPED, ticker, source + " row " + rowNumber + ": " + e.getMessage());
                continue;
            }

            if (!tradingCurrency.equalsIgnoreCase(trade.getCurrency())) {
                foreignCurrency++;
                continue;
            }

            if (trade.getOperation() == OperationType.UNRESOLVED) {
                log.warn(
                        "Unrecognized operation '{}' for {} in {} row {}; counted as a disposal of {}",
                        trade.getOperationLabel(),
                        trade.getTicker(),
                        source,
                        rowNumber,
                        trade.getQuantity());
                diagnostics.record(
                        DiagnosticType.UNRESOLVED_OPERATION,
                        trade.getTicker(),
                        source + " row " + rowNumber + ": operation '" + trade.getOperationLabel()
                                + "' matched neither buy nor sell");
            }
            trades.add(trade);
        }

        log.info(
                "Normalized {} table: rows={}, kept={}, skipped={}, otherCurrency={} (trading currency {})",
                source,
                table.size(),
                trades.size(),
                skipped,
                foreignCurrency,
                tradingCurrency);
        return List.copyOf(trades);
    }

    private Map<TradeColumn, String> resolveHeaders(RawTable table, String source, SettlementDiagnostics diagnostics) {
        Map<TradeColumn, String> headers = new EnumMap<>(TradeColumn.class);
        for (TradeColumn column : TradeColumn.values()) {
            Optional<String> header = table.findColumn(column.getHeaders());
            if (header.isPresent()) {
                headers.put(column, header.get());
                continue;
            }
            if (column.getKind() == TradeColumn.Kind.REQUIRED) {
                throw new SchemaException(source, column.canonicalName());
            }
            String placeholder = placeholderDescription(column.getKind());
            log.warn("{} table has no '{}' column; substituting {}", source, column.canonicalName(), placeholder);
            diagnostics.record(
                    DiagnosticType.MISSING_COLUMN,
                    null,
                    source + " table has no '" + column.canonicalName() + "' column; substituted " + placeholder);
        }
        return headers;
    }

    private String placeholderDescription(TradeColumn.Kind kind) {
        return switch (kind) {
            case NUMERIC -> "0";
            case CATEGORICAL -> settlementConfig.getTradingCurrency();
            case DATE -> "the current date";
            case REQUIRED -> throw new IllegalStateException("required columns have no placeholder");
        };
    }

    private Trade parseRow(Map<String, String> row, Map<TradeColumn, String> headers, LocalDate today) {
        String ticker = trimToNull(RawTable.cell(row, headers.get(TradeColumn.TICKER)));
        if (ticker == null) {
            throw new RowParseException("ticker", null, "value is blank");
        }

        String rawLabel = RawTable.cell(row, headers.get(TradeColumn.OPERATION));
        String label = rawLabel == null ? "" : rawLabel.trim();

        String tradingCurrency = settlementConfig.getTradingCurrency();
        String currency = headers.containsKey(TradeColumn.CURRENCY)
                ? nullToEmpty(RawTable.cell(row, headers.get(TradeColumn.CURRENCY)))
                : tradingCurrency;
        String commissionCurrency = headers.containsKey(TradeColumn.COMMISSION_CURRENCY)
                ? trimToNull(RawTable.cell(row, headers.get(TradeColumn.COMMISSION_CURRENCY)))
                : null;

        LocalDate tradeDate = dateOrDefault(row, headers, TradeColumn.TRADE_DATE, today);
        LocalDate settlementDate = dateOrDefault(row, headers, TradeColumn.SETTLEMENT_DATE, today);
        if (tradeDate == null && settlementDate == null) {
            throw new RowParseException(TradeColumn.SETTLEMENT_DATE.canonicalName(), null, "value is blank");
        }

        return Trade.builder()
                .ticker(ticker)
                .operation(classify(label))
                .operationLabel(label)
                .quantity(parseQuantity(row, headers))
                .price(decimalOrZero(row, headers, TradeColumn.PRICE, false))
                .currency(currency)
                .amount(decimalOrZero(row, headers, TradeColumn.AMOUNT, true).abs())
                .commission(decimalOrZero(row, headers, TradeColumn.COMMISSION, false).abs())
                .commissionCurrency(commissionCurrency != null ? commissionCurrency : tradingCurrency)
                .tradeDate(tradeDate != null ? tradeDate : settlementDate)
                .settlementDate(settlementDate != null ? settlementDate : tradeDate)
                .build();
    }

    private int parseQuantity(Map<String, String> row, Map<TradeColumn, String> headers) {
        BigDecimal quantity = decimalOrZero(row, headers, TradeColumn.QUANTITY, true);
        String raw = RawTable.cell(row, headers.get(TradeColumn.QUANTITY));
        try {
            return quantity.abs().stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new RowParseException(TradeColumn.QUANTITY.canonicalName(), raw, "must be a whole number");
        }
    }

    /** Missing column yields zero; a blank cell yields zero unless the field is mandatory. */
    private BigDecimal decimalOrZero(
            Map<String, String> row, Map<TradeColumn, String> headers, TradeColumn column, boolean mandatory) {
        String header = headers.get(column);
        if (header == null) {
            return BigDecimal.ZERO;
        }
        String raw = RawTable.cell(row, header);
        BigDecimal value;
        try {
            value = DecimalCoercion.parse(raw);
        } catch (NumberFormatException e) {
            throw new RowParseException(column.canonicalName(), raw, e);
        }
        if (value == null) {
            if (mandatory) {
                throw new RowParseException(column.canonicalName(), raw, "value is blank");
            }
            return BigDecimal.ZERO;
        }
        return value;
    }

    private LocalDate dateOrDefault(
            Map<String, String> row, Map<TradeColumn, String> headers, TradeColumn column, LocalDate fallback) {
        String header = headers.get(column);
        if (header == null) {
            return fallback;
        }
        String raw = RawTable.cell(row, header);
        try {
            return DateCoercion.parse(raw);
        } catch (DateTimeParseException e) {
            throw new RowParseException(column.canonicalName(), raw, e);
        }
    }

    private static boolean containsAny(String label, List<String> lexicon) {
        for (String token : lexicon) {
            if (label.contains(token.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
