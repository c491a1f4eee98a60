package com.marginledger.api.dto.response;

import com.marginledger.domain.enums.Direction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an open position with the ids of its live triggers.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionResponse {

    private Long id;
    private String account;
    private String assetId;
    private Direction direction;
    private BigDecimal openPrice;
    private BigDecimal margin;
    private BigDecimal size;
    private Integer leverage;
    private Instant openedAt;
    private Long sourceOrderId;
    private Long stopLossTriggerId;
    private Long takeProfitTriggerId;
    private Long liquidationTriggerId;
}
