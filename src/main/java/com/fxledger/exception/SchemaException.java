package com.fxledger.exception;

import java.util.Map;

/**
 * A structurally required column is absent from a whole input table (ticker or operation on the
 * trade table, date or rate on the rate table). Aborts the run.
 */
public class SchemaException extends BaseException {

    public SchemaException(String table, String column) {
        super(
                ErrorCode.SCHEMA_ERROR,
                "Required column '" + column + "' is missing from the " + table + " table",
                Map.of("table", table, "column", column));
    }
}
