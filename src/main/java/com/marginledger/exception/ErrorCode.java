package com.marginledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    ALREADY_EXISTS("ALREADY_EXISTS", 409),
    ORDER_NOT_CANCELABLE("ORDER_NOT_CANCELABLE", 409),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", 422),
    TRANSFER_FAILED("TRANSFER_FAILED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
