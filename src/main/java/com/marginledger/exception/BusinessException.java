package com.marginledger.exception;

import java.util.Map;

/**
 * A ledger rule violation that is neither an access nor a funds problem: invalid
 * parameters, id collisions and cancelling a market order.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static BusinessException invalidParameter(String message) {
        return new BusinessException(ErrorCode.VALIDATION_ERROR, message);
    }
}
