package com.marginledger.domain.model;

import com.marginledger.domain.enums.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An open leveraged position. Open price, asset, direction and leverage never change
 * after execution; margin stays immobilized until the position is closed.
 *
 * <p>Trigger ids are not stored here. The TriggerRegistry owns the position → trigger
 * mapping so that there is exactly one place a stale id could be left behind.
 */
@Value
@Builder
public class Position {

    long id;
    String account;
    String assetId;
    Direction direction;
    BigDecimal openPrice;
    BigDecimal margin;
    BigDecimal size;
    int leverage;
    Instant openedAt;

    /** The order this position was executed from. */
    long sourceOrderId;
}
