package com.fxledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Per-ticker net quantity and cumulative domestic-currency result over a trade set. */
@Value
@Builder
public class PositionSummary {

    String ticker;
    long signedBalance;
    BigDecimal realizedResult;

    @JsonIgnore
    public boolean isClosed() {
        return signedBalance == 0;
    }

    /** More sold than bought within the observed trades. */
    @JsonIgnore
    public boolean isOversold() {
        return signedBalance < 0;
    }
}
