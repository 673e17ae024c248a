package com.fxledger.api.dto.response;

import java.time.Instant;
import lombok.Value;

/**
 * Success envelope around every settlement endpoint payload: {@code {success, data, timestamp}}.
 * Applied by {@link com.fxledger.config.ApiResponseAdvice}; controllers return the bare report.
 */
@Value
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
