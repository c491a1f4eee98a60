package com.marginledger.event;

import com.marginledger.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a transaction that created, cancelled or executed an order commits.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LedgerAuditListener: writes the audit trail</li>
 *   <li>LedgerMetricsService: order counters</li>
 * </ul>
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        super(source);
        this.order = order;
        this.eventType = eventType;
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }
}
