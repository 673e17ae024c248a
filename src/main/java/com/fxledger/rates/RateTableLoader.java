package com.fxledger.rates;

import com.fxledger.config.SettlementConfig;
import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.model.RateEntry;
import com.fxledger.domain.model.RawTable;
import com.fxledger.exception.EmptyInputException;
import com.fxledger.exception.SchemaException;
import com.fxledger.ingest.DateCoercion;
import com.fxledger.ingest.DecimalCoercion;
import com.fxledger.settlement.SettlementDiagnostics;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a central-bank rate export into a {@link RateTable}.
 *
 * <p>Columns are looked up by canonical name or by the export's own headers ({@code data},
 * {@code curs}, {@code cdx}). When a currency name is configured and the table has a currency
 * column, only matching rows are used. Rows with an unreadable date or a non-positive rate are
 * skipped.
 */
@Service
public class RateTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RateTableLoader.class);

    public static final String RATE_TABLE = "rate";

    private static final List<String> DATE_HEADERS = List.of("date", "data");
    private static final List<String> RATE_HEADERS = List.of("rate", "curs");
    private static final List<String> CURRENCY_HEADERS = List.of("currency", "cdx");

    private final SettlementConfig settlementConfig;

    public RateTableLoader(SettlementConfig settlementConfig) {
        this.settlementConfig = settlementConfig;
    }

    /**
     * @throws EmptyInputException if the table has no rows, or none survive filtering and parsing
     * @throws SchemaException if the date or rate column is absent
     */
    public RateTable load(RawTable table, SettlementDiagnostics diagnostics) {
        if (table == null || table.isEmpty()) {
            throw new EmptyInputException(RATE_TABLE);
        }
        String dateHeader = table.findColumn(DATE_HEADERS).orElseThrow(() -> new SchemaException(RATE_TABLE, "date"));
        String rateHeader = table.findColumn(RATE_HEADERS).orElseThrow(() -> new SchemaException(RATE_TABLE, "rate"));
        Optional<String> currencyHeader = table.findColumn(CURRENCY_HEADERS);
        String currencyName = settlementConfig.getRateCurrencyName();

        List<RateEntry> entries = new ArrayList<>(table.size());
        int skipped = 0;
        for (int i = 0; i < table.size(); i++) {
            Map<String, String> row = table.getRows().get(i);
            if (currencyName != null && currencyHeader.isPresent()) {
                String currency = RawTable.cell(row, currencyHeader.get());
                if (currency == null || !currencyName.equals(currency.trim())) {
                    continue;
                }
            }
            String rawDate = RawTable.cell(row, dateHeader);
            String rawRate = RawTable.cell(row, rateHeader);
            String problem = null;
            try {
                LocalDate date = DateCoercion.parse(rawDate);
                BigDecimal rate = DecimalCoercion.parse(rawRate);
                if (date == null) {
                    problem = "date is blank";
                } else if (rate == null || rate.signum() <= 0) {
                    problem = "rate '" + rawRate + "' is not positive";
                } else {
                    entries.add(RateEntry.of(date, rate));
                }
            } catch (DateTimeParseException | NumberFormatException e) {
                problem = e.getMessage();
            }
            if (problem != null) {
                skipped++;
                log.warn("Skipping rate row {} (date={}, rate={}): {}", i + 1, rawDate, rawRate, problem);
                diagnostics.record(DiagnosticType.ROW_SKIPPED, null, RATE_TABLE + " row " + (i + 1) + ": " + problem);
            }
        }

        if (entries.isEmpty()) {
            throw new EmptyInputException(RATE_TABLE);
        }
        RateTable rateTable = RateTable.of(entries);
        log.info(
                "Loaded rate table: rows={}, dates={}, skipped={}, from={}",
                table.size(),
                rateTable.size(),
                skipped,
                rateTable.earliestDate().orElse(null));
        return rateTable;
    }
}
