package com.marginledger.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger configuration loaded from application.properties.
 *
 * <p>Properties prefix: {@code ledger.*}. The executor list and the commission receiver
 * stand in for the administrative role table, which lives outside this service.
 *
 * <p>Defaults:
 * <ul>
 *   <li>custodyAccount: ledger-custody (wallet holding all custodied value)</li>
 *   <li>commissionReceiver: fee-receiver</li>
 *   <li>executors: [executor]</li>
 *   <li>liquidation.priceScale: 10 fractional digits</li>
 *   <li>liquidation.maintenanceFraction: 0.2 (liquidate at 20% of initial margin)</li>
 *   <li>liquidation.minPrice: one unit at the price scale</li>
 * </ul>
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String custodyAccount = "ledger-custody";
    private String commissionReceiver = "fee-receiver";
    private List<String> executors = new ArrayList<>(List.of("executor"));
    private Liquidation liquidation = new Liquidation();
    private Audit audit = new Audit();

    @Data
    public static class Liquidation {
        private int priceScale = 10;
        private BigDecimal maintenanceFraction = new BigDecimal("0.2");
        private BigDecimal minPrice = new BigDecimal("0.0000000001");
    }

    @Data
    public static class Audit {
        private long conservationCheckIntervalMs = 60_000;
    }
}
