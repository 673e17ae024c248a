package com.fxledger.exception;

import java.util.Map;

/** A trade or rate table carries no usable rows. Aborts the run. */
public class EmptyInputException extends BaseException {

    public EmptyInputException(String table) {
        super(ErrorCode.EMPTY_INPUT, "The " + table + " table is empty", Map.of("table", table));
    }
}
