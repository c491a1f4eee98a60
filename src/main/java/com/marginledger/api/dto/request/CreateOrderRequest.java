package com.marginledger.api.dto.request;

import com.marginledger.domain.enums.Direction;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating an order. A zero or absent target price creates a market order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @NotBlank(message = "Account is required")
    private String account;

    @NotBlank(message = "Asset is required")
    private String assetId;

    @NotNull(message = "Direction is required")
    private Direction direction;

    @PositiveOrZero
    private BigDecimal targetPrice;

    @PositiveOrZero
    private BigDecimal stopLossPrice;

    @PositiveOrZero
    private BigDecimal takeProfitPrice;

    @PositiveOrZero
    private BigDecimal commission;

    @NotNull(message = "Margin is required")
    @Positive
    private BigDecimal margin;

    @NotNull(message = "Size is required")
    @Positive
    private BigDecimal size;

    @NotNull(message = "Leverage is required")
    @Min(value = 1, message = "Leverage must be at least 1")
    private Integer leverage;
}
