package com.fxledger.domain.enums;

/** Where a trade row came from: the period being settled or a borrowed prior-period lot. */
public enum TradeOrigin {
    CURRENT_PERIOD,
    PRIOR_PERIOD
}
