package com.fxledger.domain.enums;

/**
 * Canonical side of a trade, derived once from the broker's free-text operation label.
 *
 * <p>UNRESOLVED marks labels that matched neither lexicon. Anything that is not a recognized
 * purchase reduces the position balance the way a sale does, which can distort the balance; the
 * normalizer records a diagnostic for every one of them.
 */
public enum OperationType {
    BUY,
    SELL,
    UNRESOLVED;

    /** Only a buy adds to the held quantity; sell and unresolved consume it. */
    public long signedQuantity(long quantity) {
        return this == BUY ? quantity : -quantity;
    }
}
