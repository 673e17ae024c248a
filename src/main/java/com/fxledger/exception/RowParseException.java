package com.fxledger.exception;

import java.util.Map;

/**
 * A single trade or rate row could not be coerced into typed values. Always recovered by the
 * caller: the row is logged, recorded as a diagnostic and excluded.
 */
public class RowParseException extends BaseException {

    public RowParseException(String field, String value, String reason) {
        super(
                ErrorCode.ROW_PARSE_ERROR,
                "Cannot parse " + field + " '" + value + "': " + reason,
                Map.of("field", field, "value", String.valueOf(value)));
    }

    public RowParseException(String field, String value, Throwable cause) {
        super(ErrorCode.ROW_PARSE_ERROR, "Cannot parse " + field + " '" + value + "': " + cause.getMessage(), cause);
    }
}
