package com.justtrades.api.dto.response;

import com.justtrades.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Error envelope. {@code error.code} is the stable {@link ErrorCode} name callers switch on.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(
                new ErrorDetail(errorCode.getCode(), message, details == null ? Map.of() : details, Instant.now(), path));
    }

    public record ErrorDetail(
            String code, String message, Map<String, Object> details, Instant timestamp, String path) {}
}
