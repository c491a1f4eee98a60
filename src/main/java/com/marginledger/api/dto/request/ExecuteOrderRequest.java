package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attested fill for executing an order into a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteOrderRequest {

    @NotNull(message = "Open price is required")
    @Positive
    private BigDecimal openPrice;

    @NotNull(message = "Open time is required")
    private Instant openedAt;
}
