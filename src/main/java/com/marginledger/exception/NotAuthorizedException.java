package com.marginledger.exception;

/**
 * Thrown when the caller is neither the owner of the order/position it targets
 * nor an authorized executor, or when an executor-only operation is invoked by a trader.
 */
public class NotAuthorizedException extends BaseException {

    public NotAuthorizedException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
