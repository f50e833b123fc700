package org.iceforge.dataseap.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every service API response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String code, String message, T data, Error error) {

    public record Error(String code, String message, String details) {}

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, "OK", "success", data, null);
    }

    public static <T> ApiResponse<T> failure(String code, String message, String details, T data) {
        return new ApiResponse<>(false, code, message, data, new Error(code, message, details));
    }
}
