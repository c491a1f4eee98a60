package com.marginledger.service;

import com.marginledger.domain.model.CloseSettlement;
import com.marginledger.domain.model.Position;
import com.marginledger.event.BalanceEvent;
import com.marginledger.event.OrderEvent;
import com.marginledger.event.PositionEvent;
import com.marginledger.event.TriggerEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Turns every committed ledger event into an audit_logs row.
 * Runs at @Order(10), ahead of the metrics listener.
 */
@Component
public class LedgerAuditListener {

    private final AuditService auditService;

    public LedgerAuditListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    @Order(10)
    public void onOrderEvent(OrderEvent event) {
        com.marginledger.domain.model.Order order = event.getOrder();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("assetId", order.getAssetId());
        context.put("direction", order.getDirection().name());
        context.put("targetPrice", order.getTargetPrice());
        context.put("margin", order.getMargin());
        context.put("commission", order.getCommission());
        context.put("size", order.getSize());
        context.put("leverage", order.getLeverage());

        auditService.log(
                "ORDER_" + event.getEventType().name(),
                "ORDER",
                String.valueOf(order.getId()),
                event.getEventType().name(),
                null,
                null,
                order.getAccount(),
                context);
    }

    @EventListener
    @Order(10)
    public void onPositionEvent(PositionEvent event) {
        Position position = event.getPosition();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("assetId", position.getAssetId());
        context.put("direction", position.getDirection().name());
        context.put("openPrice", position.getOpenPrice());
        context.put("margin", position.getMargin());
        context.put("leverage", position.getLeverage());
        context.put("sourceOrderId", position.getSourceOrderId());

        CloseSettlement settlement = event.getSettlement();
        if (settlement != null) {
            context.put("pnl", settlement.getPnl());
            context.put("closingCommission", settlement.getClosingCommission());
            context.put("payout", settlement.getPayout());
            context.put("poolDelta", settlement.getPoolDelta());
            context.put("uncollectedLoss", settlement.getUncollectedLoss());
        }

        auditService.log(
                "POSITION_" + event.getEventType().name(),
                "POSITION",
                String.valueOf(position.getId()),
                event.getEventType().name(),
                null,
                null,
                position.getAccount(),
                context);
    }

    @EventListener
    @Order(10)
    public void onTriggerEvent(TriggerEvent event) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("positionId", event.getPositionId());
        context.put("kind", event.getKind().name());
        if (event.getPrice() != null) {
            context.put("price", event.getPrice());
        }

        auditService.log(
                "TRIGGER_" + event.getEventType().name(),
                "POSITION",
                String.valueOf(event.getPositionId()),
                event.getKind().name(),
                idOrNull(event.getOldTriggerId()),
                idOrNull(event.getNewTriggerId()),
                null,
                context);
    }

    @EventListener
    @Order(10)
    public void onBalanceEvent(BalanceEvent event) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("amount", event.getAmount());
        context.put("balanceAfter", event.getBalanceAfter());

        boolean pool = event.getAccount() == null;
        auditService.log(
                "BALANCE_" + event.getEventType().name(),
                pool ? "POOL" : "COMMISSION",
                pool ? "pool" : event.getAccount(),
                event.getEventType().name(),
                null,
                null,
                event.getAccount(),
                context);
    }

    private static String idOrNull(Long id) {
        return id == null ? null : String.valueOf(id);
    }
}
