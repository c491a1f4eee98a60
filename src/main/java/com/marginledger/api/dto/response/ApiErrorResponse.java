package com.marginledger.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marginledger.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope rendered by the GlobalExceptionHandler. Mirrors {@link ApiResponse}:
 * {@code caller} echoes the {@code X-Account} header when one was sent.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    private final boolean success = false;
    private final String caller;
    private final ErrorDetail error;

    private ApiErrorResponse(String caller, ErrorDetail error) {
        this.caller = caller;
        this.error = error;
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, String caller) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(caller, errorDetail);
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
