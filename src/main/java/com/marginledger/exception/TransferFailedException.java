package com.marginledger.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown when the value-transfer gateway denies a pull or push, or fails while moving value.
 * The details carry the counterparty account and the amount that did not move.
 */
public class TransferFailedException extends BaseException {

    public TransferFailedException(String message, String account, BigDecimal amount) {
        super(ErrorCode.TRANSFER_FAILED, message, details(account, amount));
    }

    public TransferFailedException(String message, String account, BigDecimal amount, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED, message, details(account, amount), cause);
    }

    private static Map<String, Object> details(String account, BigDecimal amount) {
        return Map.of("account", account, "amount", amount);
    }
}
