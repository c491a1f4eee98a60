package com.marginledger.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for a closed position. {@code poolDelta} is negative when the
 * pool paid a profit and positive when it absorbed a loss.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CloseSettlementResponse {

    private Long positionId;
    private String account;
    private BigDecimal pnl;
    private BigDecimal closingCommission;
    private BigDecimal marginNet;
    private BigDecimal payout;
    private BigDecimal poolDelta;
    private BigDecimal uncollectedLoss;
}
