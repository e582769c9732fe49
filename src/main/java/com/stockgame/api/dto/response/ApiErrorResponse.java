package com.stockgame.api.dto.response;

import com.stockgame.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;
import lombok.Value;

/**
 * Body of every failed {@code /api} response, built by {@code GlobalExceptionHandler}.
 *
 * <p>{@code error.code} is the stable {@link ErrorCode} name clients branch on; {@code
 * error.details} carries the offending ids or field messages and is empty when there are none.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final Failure error;

    private ApiErrorResponse(Failure error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(new Failure(
                errorCode.getCode(), message, details != null ? details : Map.of(), path, Instant.now()));
    }

    @Value
    public static class Failure {
        String code;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
