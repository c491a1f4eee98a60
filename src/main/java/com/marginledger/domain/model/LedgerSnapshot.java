package com.marginledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time decomposition of custodied value, taken under the ledger read lock.
 * {@code balanced} is true when custodied value equals the sum of all components.
 */
@Value
@Builder
public class LedgerSnapshot {

    BigDecimal custodiedValue;
    BigDecimal orderMargin;
    BigDecimal orderCommission;
    BigDecimal positionMargin;
    BigDecimal accruedCommission;
    BigDecimal poolBalance;
    int liveOrders;
    int livePositions;
    int liveTriggers;

    public BigDecimal getAccountedValue() {
        return orderMargin
                .add(orderCommission)
                .add(positionMargin)
                .add(accruedCommission)
                .add(poolBalance);
    }

    public boolean isBalanced() {
        return custodiedValue.compareTo(getAccountedValue()) == 0;
    }
}
