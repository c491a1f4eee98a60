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
 * REST API response DTO for a pending order.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderResponse {

    private Long id;
    private String account;
    private String assetId;
    private Direction direction;
    private BigDecimal targetPrice;
    private BigDecimal stopLossPrice;
    private BigDecimal takeProfitPrice;
    private BigDecimal commission;
    private BigDecimal margin;
    private BigDecimal size;
    private Integer leverage;
    private Instant createdAt;
    private boolean conditional;
    private BigDecimal lockedAmount;
}
