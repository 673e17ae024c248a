package com.fxledger.unit.rates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fxledger.config.SettlementConfig;
import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.model.RawTable;
import com.fxledger.exception.EmptyInputException;
import com.fxledger.exception.SchemaException;
import com.fxledger.rates.RateTable;
import com.fxledger.rates.RateTableLoader;
import com.fxledger.settlement.SettlementDiagnostics;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RateTableLoaderTest {

    private SettlementConfig settlementConfig;
    private RateTableLoader rateTableLoader;
    private SettlementDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        settlementConfig = new SettlementConfig();
        rateTableLoader = new RateTableLoader(settlementConfig);
        diagnostics = new SettlementDiagnostics();
    }

    @Test
    @DisplayName("Central-bank export headers with comma decimals")
    void centralBankExport() {
        RawTable table = RawTable.of(List.of(
                Map.of("data", "01.01.2024", "curs", "90,0000", "cdx", "Доллар США"),
                Map.of("data", "10.01.2024", "curs", "92,5000", "cdx", "Доллар США")));

        RateTable rateTable = rateTableLoader.load(table, diagnostics);

        assertThat(rateTable.size()).isEqualTo(2);
        assertThat(rateTable.lookup(LocalDate.of(2024, 1, 5)).orElseThrow()).isEqualByComparingTo("90");
        assertThat(diagnostics.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Only rows of the configured currency are used")
    void currencyFilter() {
        settlementConfig.setRateCurrencyName("Доллар США");
        RawTable table = RawTable.of(List.of(
                Map.of("date", "2024-01-01", "rate", "90.00", "currency", "Доллар США"),
                Map.of("date", "2024-01-02", "rate", "98.00", "currency", "Евро")));

        RateTable rateTable = rateTableLoader.load(table, diagnostics);

        assertThat(rateTable.size()).isEqualTo(1);
        assertThat(rateTable.lookup(LocalDate.of(2024, 1, 2))).contains(new BigDecimal("90.00"));
    }

    @Test
    @DisplayName("Unreadable and non-positive rows are skipped with diagnostics")
    void badRowsSkipped() {
        RawTable table = RawTable.of(List.of(
                Map.of("date", "2024-01-01", "rate", "90.00"),
                Map.of("date", "yesterday", "rate", "91.00"),
                Map.of("date", "2024-01-03", "rate", "0"),
                Map.of("date", "2024-01-04", "rate", "-1")));

        RateTable rateTable = rateTableLoader.load(table, diagnostics);

        assertThat(rateTable.size()).isEqualTo(1);
        assertThat(diagnostics.count(DiagnosticType.ROW_SKIPPED)).isEqualTo(3);
    }

    @Test
    @DisplayName("Missing rate column aborts the run")
    void missingRateColumn() {
        RawTable table = RawTable.of(List.of(Map.of("date", "2024-01-01", "value", "90.00")));

        assertThatThrownBy(() -> rateTableLoader.load(table, diagnostics))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("rate");
    }

    @Test
    @DisplayName("Empty table, or no usable rows, aborts the run")
    void emptyTable() {
        assertThatThrownBy(() -> rateTableLoader.load(RawTable.of(List.of()), diagnostics))
                .isInstanceOf(EmptyInputException.class);
        RawTable allBad = RawTable.of(List.of(Map.of("date", "2024-01-01", "rate", "0")));
        assertThatThrownBy(() -> rateTableLoader.load(allBad, diagnostics)).isInstanceOf(EmptyInputException.class);
    }
}
