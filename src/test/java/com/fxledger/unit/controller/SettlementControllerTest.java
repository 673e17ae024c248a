package com.fxledger.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fxledger.api.controller.SettlementController;
import com.fxledger.config.ApiResponseAdvice;
import com.fxledger.domain.model.ClosedPosition;
import com.fxledger.domain.model.PositionSummary;
import com.fxledger.domain.model.SettlementReport;
import com.fxledger.domain.model.SettlementRequest;
import com.fxledger.exception.EmptyInputException;
import com.fxledger.exception.GlobalExceptionHandler;
import com.fxledger.exception.SchemaException;
import com.fxledger.settlement.SettlementPipeline;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the SettlementController, with the response envelope and the
 * exception handler registered as controller advice.
 */
@ExtendWith(MockitoExtension.class)
class SettlementControllerTest {

    private static final String RUN_BODY = """
            {
              "trades": {
                "rows": [
                  {"ticker": "XYZ", "operation": "Buy", "quantity": "10", "amount": "1000.00",
                   "settlementDate": "2024-01-05"}
                ]
              },
              "rates": {
                "columns": ["date", "rate"],
                "rows": [{"date": "2024-01-01", "rate": "90.00"}]
              },
              "priorPeriods": [
                {"rows": [{"ticker": "XYZ", "operation": "Buy", "quantity": "3", "amount": "300.00"}]}
              ],
              "declaredBalances": {"XYZ": 10}
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private SettlementPipeline settlementPipeline;

    @BeforeEach
    void setUp() {
        SettlementController controller = new SettlementController(settlementPipeline);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static SettlementReport report() {
        return SettlementReport.builder()
                .tradingCurrency("USD")
                .domesticCurrency("RUB")
                .settledTrades(List.of())
                .positions(List.of(PositionSummary.builder()
                        .ticker("XYZ")
                        .signedBalance(0)
                        .realizedResult(new BigDecimal("180.00"))
                        .build()))
                .closedPositions(List.of(ClosedPosition.builder()
                        .ticker("XYZ")
                        .totalBuys(new BigDecimal("1000.00"))
                        .totalSells(new BigDecimal("1200.00"))
                        .totalCommission(new BigDecimal("20.00"))
                        .netResult(new BigDecimal("180.00"))
                        .build()))
                .insufficientData(List.of())
                .uncoveredShortfalls(List.of())
                .diagnostics(List.of())
                .build();
    }

    @Test
    @DisplayName("POST /api/settlements/run returns the report in the envelope")
    void runReturnsReport() throws Exception {
        when(settlementPipeline.run(any(SettlementRequest.class))).thenReturn(report());

        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.tradingCurrency").value("USD"))
                .andExpect(jsonPath("$.data.positions[0].ticker").value("XYZ"))
                .andExpect(jsonPath("$.data.positions[0].signedBalance").value(0))
                .andExpect(jsonPath("$.data.closedPositions[0].netResult").value(180.0))
                .andExpect(jsonPath("$.data.borrowedTradeCount").value(0));
    }

    @Test
    @DisplayName("Request body is converted into raw tables and declared balances")
    void requestConversion() throws Exception {
        when(settlementPipeline.run(any(SettlementRequest.class))).thenReturn(report());

        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY))
                .andExpect(status().isOk());

        ArgumentCaptor<SettlementRequest> captor = ArgumentCaptor.forClass(SettlementRequest.class);
        verify(settlementPipeline).run(captor.capture());
        SettlementRequest request = captor.getValue();
        assertThat(request.getTrades().size()).isEqualTo(1);
        assertThat(request.getTrades().getColumns())
                .containsExactly("ticker", "operation", "quantity", "amount", "settlementDate");
        assertThat(request.getRates().getColumns()).containsExactly("date", "rate");
        assertThat(request.getPriorPeriods()).hasSize(1);
        assertThat(request.getDeclaredBalances()).containsEntry("XYZ", 10L);
    }

    @Test
    @DisplayName("Missing rate table is a 400 validation error")
    void missingRates() throws Exception {
        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trades\": {\"rows\": []}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.rates").exists());

        verify(settlementPipeline, never()).run(any());
    }

    @Test
    @DisplayName("Missing required column is a 422 schema error")
    void schemaError() throws Exception {
        when(settlementPipeline.run(any(SettlementRequest.class))).thenThrow(new SchemaException("trade", "ticker"));

        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("SCHEMA_ERROR"))
                .andExpect(jsonPath("$.error.details.column").value("ticker"));
    }

    @Test
    @DisplayName("Empty input table is a 422 empty-input error")
    void emptyInput() throws Exception {
        when(settlementPipeline.run(any(SettlementRequest.class))).thenThrow(new EmptyInputException("rate"));

        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("EMPTY_INPUT"));
    }

    @Test
    @DisplayName("Unexpected failure is a 500 without details")
    void unexpectedFailure() throws Exception {
        when(settlementPipeline.run(any(SettlementRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/settlements/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error.path").value("/api/settlements/run"))
                .andExpect(jsonPath("$.error.details").doesNotExist());
    }
}
