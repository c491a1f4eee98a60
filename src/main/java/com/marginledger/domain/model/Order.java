package com.marginledger.domain.model;

import com.marginledger.domain.enums.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A pending order holding locked margin and commission in custody.
 *
 * <p>A zero {@code targetPrice} marks an immediate ("market") order; any positive value
 * marks a conditional ("limit") order, which is the only kind the owner may cancel.
 * Zero stop-loss / take-profit prices mean "no trigger requested".
 *
 * <p>Instances are immutable snapshots; the OrderBook is the sole owner of live records.
 */
@Value
@Builder
public class Order {

    long id;
    String account;
    String assetId;
    Direction direction;
    BigDecimal targetPrice;
    BigDecimal stopLossPrice;
    BigDecimal takeProfitPrice;
    BigDecimal commission;
    BigDecimal margin;
    BigDecimal size;
    int leverage;
    Instant createdAt;

    public boolean isConditional() {
        return targetPrice.signum() != 0;
    }

    /** Total value locked at creation and refunded on cancellation. */
    public BigDecimal getLockedAmount() {
        return margin.add(commission);
    }
}
