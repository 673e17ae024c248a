package com.fxledger.api.dto.request;

import com.fxledger.domain.model.SettlementRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of {@code POST /api/settlements/run}.
 *
 * <p>Validated at the controller layer before conversion to the {@link SettlementRequest} domain
 * model. Prior periods and declared balances are optional.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettlementRunRequest {

    @NotNull(message = "Trade table is required")
    @Valid
    private RawTableRequest trades;

    @NotNull(message = "Rate table is required")
    @Valid
    private RawTableRequest rates;

    @Valid
    private List<RawTableRequest> priorPeriods;

    private Map<String, Long> declaredBalances;

    public SettlementRequest toSettlementRequest() {
        SettlementRequest.SettlementRequestBuilder builder = SettlementRequest.builder()
                .trades(trades.toRawTable())
                .rates(rates.toRawTable());
        if (priorPeriods != null) {
            priorPeriods.forEach(table -> builder.priorPeriod(table.toRawTable()));
        }
        if (declaredBalances != null) {
            declaredBalances.forEach((ticker, balance) -> {
                if (balance != null) {
                    builder.declaredBalance(ticker, balance);
                }
            });
        }
        return builder.build();
    }
}
