package com.fxledger.domain.model;

import lombok.Builder;
import lombok.Value;

/** A negative balance that prior-period lots could not fully cover. residual = shortfall - covered. */
@Value
@Builder
public class UncoveredShortfall {

    String ticker;
    long shortfall;
    long covered;
    long residual;
}
