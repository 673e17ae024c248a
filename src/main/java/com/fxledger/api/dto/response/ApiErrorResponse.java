package com.fxledger.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fxledger.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Failure envelope written by {@link com.fxledger.exception.GlobalExceptionHandler}.
 *
 * <p>{@code error.details} names the offending table and column for rejected runs, or the invalid
 * request fields for validation failures. It is left out when there is nothing to add.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
