package com.marginledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of closing a position, carried on the CLOSED position event for audit.
 *
 * <p>{@code poolDelta} is signed from the pool's point of view: negative when the pool
 * paid a profit, positive when it absorbed a loss. {@code uncollectedLoss} is the part
 * of a loss exceeding the net margin; trader liability is capped at margin, so this
 * amount is reported and never collected.
 */
@Value
@Builder
public class CloseSettlement {

    long positionId;
    String account;
    BigDecimal pnl;
    BigDecimal closingCommission;
    BigDecimal marginNet;
    BigDecimal payout;
    BigDecimal poolDelta;
    BigDecimal uncollectedLoss;
}
