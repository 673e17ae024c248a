package com.fxledger.domain.enums;

/**
 * Recovered data problems surfaced alongside a settlement report.
 *
 * <p>None of these abort a run. NO_RATE_FOUND is the most serious: the affected trade was settled
 * at a zero rate, so its domestic amounts are zero.
 */
public enum DiagnosticType {
    ROW_SKIPPED,
    MISSING_COLUMN,
    NO_RATE_FOUND,
    UNRESOLVED_OPERATION,
    INSUFFICIENT_PRIOR_DATA,
    PRIOR_TABLE_SKIPPED
}
