package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New stop-loss or take-profit price. Zero clears the trigger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TriggerPriceRequest {

    @NotNull(message = "Price is required")
    @PositiveOrZero
    private BigDecimal price;
}
