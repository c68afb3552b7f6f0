package com.optionanalytics.api.dto.response;

import com.optionanalytics.exception.BaseException;
import com.optionanalytics.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope, {@code {"success": false, "error": {...}}}, produced by
 * {@link com.optionanalytics.exception.GlobalExceptionHandler}. For rejected inputs
 * {@code error.details} carries the offending field and value, or one entry per invalid
 * request property after Bean Validation.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final Failure error;

    private ApiErrorResponse(Failure error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(Failure.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    public static ApiErrorResponse of(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }

    @Getter
    @Builder
    public static class Failure {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
