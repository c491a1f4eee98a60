package com.marginledger.domain.enums;

/**
 * Kinds of priced conditions attached to a position. All kinds draw their ids from a
 * single shared counter in the TriggerRegistry.
 */
public enum TriggerKind {

    /** Replaceable. Cleared by setting price zero. */
    STOP_LOSS,

    /** Replaceable. Cleared by setting price zero. */
    TAKE_PROFIT,

    /** Write-once at execution time; removed only with the position. */
    LIQUIDATION;

    public boolean isReplaceable() {
        return this != LIQUIDATION;
    }
}
