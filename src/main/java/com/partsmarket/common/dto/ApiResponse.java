package com.partsmarket.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every successful REST response.
 * Errors are rendered as {@code ProblemDetail} by the global handler instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
