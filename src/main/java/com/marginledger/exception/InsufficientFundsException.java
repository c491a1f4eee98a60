package com.marginledger.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown when a ledger balance cannot cover a requested debit: the pool cannot pay a
 * trader profit, a closing commission exceeds the position margin, or there is no
 * accrued commission to withdraw.
 */
public class InsufficientFundsException extends BaseException {

    public InsufficientFundsException(String message, BigDecimal available, BigDecimal required) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message, Map.of("available", available, "required", required));
    }
}
