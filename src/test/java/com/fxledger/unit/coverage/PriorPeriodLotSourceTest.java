package com.fxledger.unit.coverage;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxledger.config.SettlementConfig;
import com.fxledger.coverage.PriorPeriodLotSource;
import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.model.RawTable;
import com.fxledger.domain.model.Trade;
import com.fxledger.ingest.TradeNormalizer;
import com.fxledger.settlement.SettlementDiagnostics;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriorPeriodLotSourceTest {

    private PriorPeriodLotSource priorPeriodLotSource;
    private SettlementDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
        priorPeriodLotSource = new PriorPeriodLotSource(new TradeNormalizer(new SettlementConfig(), clock));
        diagnostics = new SettlementDiagnostics();
    }

    private static Map<String, String> row(String ticker, String operation, String quantity, String tradeDate) {
        return Map.of(
                "ticker", ticker,
                "operation", operation,
                "quantity", quantity,
                "amount", "100.00",
                "currency", "USD",
                "commission", "1.00",
                "commissionCurrency", "USD",
                "price", "10.00",
                "tradeDate", tradeDate,
                "settlementDate", tradeDate);
    }

    @Test
    @DisplayName("Purchase and opening rows from all tables, most recent first")
    void lotsMostRecentFirst() {
        RawTable older = RawTable.of(List.of(
                row("ABC", "Покупка", "10", "2023-06-01"), row("ABC", "Продажа", "4", "2023-06-15")));
        RawTable newer = RawTable.of(List.of(
                row("ABC", "Открытие позиции", "3", "2023-11-20"), row("ABC", "Покупка", "8", "2023-11-10")));

        List<Trade> lots = priorPeriodLotSource.collect(List.of(older, newer), diagnostics);

        assertThat(lots).extracting(Trade::getTradeDate)
                .containsExactly(
                        LocalDate.of(2023, 11, 20), LocalDate.of(2023, 11, 10), LocalDate.of(2023, 6, 1));
        assertThat(lots).extracting(Trade::getQuantity).containsExactly(3, 8, 10);
    }

    @Test
    @DisplayName("Equal dates keep table order")
    void stableOnTies() {
        RawTable table = RawTable.of(List.of(
                row("FIRST", "Покупка", "1", "2023-06-01"), row("SECOND", "Покупка", "2", "2023-06-01")));

        List<Trade> lots = priorPeriodLotSource.collect(List.of(table), diagnostics);

        assertThat(lots).extracting(Trade::getTicker).containsExactly("FIRST", "SECOND");
    }

    @Test
    @DisplayName("Unreadable prior tables are skipped, not fatal")
    void unreadableTablesSkipped() {
        RawTable empty = RawTable.of(List.of());
        RawTable noTicker = RawTable.of(List.of(Map.of("operation", "Покупка", "quantity", "1", "amount", "1")));
        RawTable good = RawTable.of(List.of(row("ABC", "Покупка", "5", "2023-06-01")));

        List<Trade> lots = priorPeriodLotSource.collect(List.of(empty, noTicker, good), diagnostics);

        assertThat(lots).hasSize(1);
        assertThat(diagnostics.count(DiagnosticType.PRIOR_TABLE_SKIPPED)).isEqualTo(2);
    }

    @Test
    @DisplayName("No prior tables, no lots")
    void noTables() {
        assertThat(priorPeriodLotSource.collect(List.of(), diagnostics)).isEmpty();
    }
}
