package com.marginledger.event;

public enum BalanceEventType {
    COMMISSION_ACCRUED,
    COMMISSION_WITHDRAWN,
    POOL_FUNDED,
    POOL_CREDITED,
    POOL_DEBITED
}
