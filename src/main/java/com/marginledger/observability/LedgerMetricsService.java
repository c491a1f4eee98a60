package com.marginledger.observability;

import com.marginledger.event.OrderEvent;
import com.marginledger.event.OrderEventType;
import com.marginledger.event.PositionEvent;
import com.marginledger.event.PositionEventType;
import com.marginledger.event.TriggerEvent;
import com.marginledger.event.TriggerEventType;
import com.marginledger.service.LedgerConservationAuditor;
import com.marginledger.service.LedgerQueryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the ledger's Micrometer metrics.
 *
 * <ul>
 *   <li><b>ledger.orders</b> (counter, tag {@code event}): CREATED / CANCELLED / EXECUTED</li>
 *   <li><b>ledger.positions</b> (counter, tag {@code event}): OPENED / CLOSED</li>
 *   <li><b>ledger.triggers.set</b> (counter): trigger ids allocated</li>
 *   <li><b>ledger.pool.balance</b> (gauge)</li>
 *   <li><b>ledger.custody.value</b> (gauge)</li>
 *   <li><b>ledger.conservation.violations</b> (gauge)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer during scrape. Counters are driven by
 * the committed ledger events.
 */
@Service
public class LedgerMetricsService {

    private final Map<OrderEventType, Counter> orderCounters = new EnumMap<>(OrderEventType.class);
    private final Map<PositionEventType, Counter> positionCounters = new EnumMap<>(PositionEventType.class);
    private final Counter triggersSetCounter;

    public LedgerMetricsService(
            MeterRegistry meterRegistry,
            LedgerQueryService ledgerQueryService,
            LedgerConservationAuditor ledgerConservationAuditor) {
        for (OrderEventType type : OrderEventType.values()) {
            orderCounters.put(
                    type,
                    Counter.builder("ledger.orders")
                            .description("Order transitions committed")
                            .tag("event", type.name())
                            .register(meterRegistry));
        }
        for (PositionEventType type : PositionEventType.values()) {
            positionCounters.put(
                    type,
                    Counter.builder("ledger.positions")
                            .description("Position transitions committed")
                            .tag("event", type.name())
                            .register(meterRegistry));
        }
        this.triggersSetCounter = Counter.builder("ledger.triggers.set")
                .description("Trigger ids allocated")
                .register(meterRegistry);

        meterRegistry.gauge("ledger.pool.balance", ledgerQueryService, service -> service.getPoolBalance()
                .doubleValue());
        meterRegistry.gauge("ledger.custody.value", ledgerQueryService, service -> service.getCustodiedValue()
                .doubleValue());
        meterRegistry.gauge(
                "ledger.conservation.violations",
                ledgerConservationAuditor,
                LedgerConservationAuditor::getViolationCount);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        orderCounters.get(event.getEventType()).increment();
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        positionCounters.get(event.getEventType()).increment();
    }

    @EventListener
    @Order(20)
    public void onTriggerEvent(TriggerEvent event) {
        if (event.getEventType() == TriggerEventType.SET) {
            triggersSetCounter.increment();
        }
    }
}
