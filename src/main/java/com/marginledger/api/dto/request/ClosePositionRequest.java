package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attested close: signed pnl (negative for a loss) and the closing commission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePositionRequest {

    @NotNull(message = "Pnl is required")
    private BigDecimal pnl;

    @NotNull(message = "Closing commission is required")
    @PositiveOrZero
    private BigDecimal closingCommission;
}
