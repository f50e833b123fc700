package org.iceforge.dataseap.api;

import org.iceforge.dataseap.engine.load.StreamLoadFailedException;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {}

    static HttpStatus status(ErrorCode code) {
        return switch (code) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            case DATABASE_ERROR, NETWORK_ERROR, DESERIALIZATION_ERROR -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static <T> ResponseEntity<ApiResponse<T>> toResponse(DataseapException e) {
        return toResponse(e, null);
    }

    /** Failure envelope that still carries a payload, such as partial results. */
    static <T> ResponseEntity<ApiResponse<T>> toResponse(DataseapException e, T data) {
        HttpStatus status = status(e.code());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.toString());
        } else {
            log.debug("Request rejected: {}", e.toString());
        }
        String details = e instanceof StreamLoadFailedException slf && slf.response() != null
                ? slf.response().errorUrl()
                : null;
        return ResponseEntity.status(status).body(ApiResponse.failure(e.code().name(), e.getMessage(), details, data));
    }

    static <T> ResponseEntity<ApiResponse<T>> ok(T data) {
        return ResponseEntity.ok(ApiResponse.ok(data));
    }
}
