package com.marginledger.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for every ledger endpoint. {@code caller} echoes the account the
 * request was made as; it is omitted for anonymous reads.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final String caller;
    private final Instant timestamp;

    private ApiResponse(T data, String caller) {
        this.success = true;
        this.data = data;
        this.caller = caller;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data, String caller) {
        return new ApiResponse<>(data, caller);
    }
}
