package com.marginledger.oms;

import com.marginledger.domain.enums.Direction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters for {@link OrderBook#create}. Commission is recorded exactly as supplied;
 * the rate table that computes it lives upstream of the ledger.
 *
 * <p>Null prices are treated as zero: a null target price is a market order and null
 * stop-loss / take-profit prices request no trigger.
 */
@Data
@Builder
public class OrderRequest {

    private String account;
    private String assetId;
    private Direction direction;
    private BigDecimal targetPrice;
    private BigDecimal stopLossPrice;
    private BigDecimal takeProfitPrice;
    private BigDecimal commission;
    private BigDecimal margin;
    private BigDecimal size;
    private int leverage;
}
