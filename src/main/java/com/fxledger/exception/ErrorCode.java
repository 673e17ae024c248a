package com.fxledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ROW_PARSE_ERROR("ROW_PARSE_ERROR", 422),
    SCHEMA_ERROR("SCHEMA_ERROR", 422),
    EMPTY_INPUT("EMPTY_INPUT", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
