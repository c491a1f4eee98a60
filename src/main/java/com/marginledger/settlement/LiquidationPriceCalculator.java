package com.marginledger.settlement;

import com.marginledger.config.LedgerProperties;
import com.marginledger.domain.enums.Direction;
import com.marginledger.exception.BusinessException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Computes the price at which a leveraged position has lost all but the maintenance
 * fraction of its margin.
 *
 * <p>The tolerated adverse move is {@code openPrice × (1 − maintenanceFraction) / leverage},
 * computed with {@code priceScale} fractional digits and rounded toward zero. With the
 * default fraction of 0.2 this is {@code openPrice × 0.8 / leverage}:
 * <ul>
 *   <li>LONG: {@code openPrice − move}, never below {@code minPrice}</li>
 *   <li>SHORT: {@code openPrice + move}</li>
 * </ul>
 */
@Component
public class LiquidationPriceCalculator {

    private final int priceScale;
    private final BigDecimal lossFraction;
    private final BigDecimal minPrice;

    public LiquidationPriceCalculator(LedgerProperties ledgerProperties) {
        LedgerProperties.Liquidation liquidation = ledgerProperties.getLiquidation();
        this.priceScale = liquidation.getPriceScale();
        this.lossFraction = BigDecimal.ONE.subtract(liquidation.getMaintenanceFraction());
        this.minPrice = liquidation.getMinPrice();
    }

    public BigDecimal calculate(Direction direction, BigDecimal openPrice, int leverage) {
        if (openPrice == null || openPrice.signum() <= 0) {
            throw BusinessException.invalidParameter("Open price must be positive");
        }
        if (leverage < 1) {
            throw BusinessException.invalidParameter("Leverage must be at least 1");
        }

        BigDecimal move = openPrice
                .multiply(lossFraction)
                .divide(BigDecimal.valueOf(leverage), priceScale, RoundingMode.DOWN);

        if (direction == Direction.LONG) {
            BigDecimal price = openPrice.subtract(move);
            return price.compareTo(minPrice) < 0 ? minPrice : price;
        }
        return openPrice.add(move);
    }
}
