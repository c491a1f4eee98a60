package com.marginledger.event;

import com.marginledger.domain.enums.TriggerKind;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

public class TriggerEvent extends ApplicationEvent {

    private final TriggerEventType eventType;
    private final long positionId;
    private final TriggerKind kind;
    private final Long oldTriggerId;
    private final Long newTriggerId;
    private final BigDecimal price;

    public TriggerEvent(
            Object source,
            TriggerEventType eventType,
            long positionId,
            TriggerKind kind,
            Long oldTriggerId,
            Long newTriggerId,
            BigDecimal price) {
        super(source);
        this.eventType = eventType;
        this.positionId = positionId;
        this.kind = kind;
        this.oldTriggerId = oldTriggerId;
        this.newTriggerId = newTriggerId;
        this.price = price;
    }

    public static TriggerEvent set(Object source, long positionId, TriggerKind kind, long triggerId, BigDecimal price) {
        return new TriggerEvent(source, TriggerEventType.SET, positionId, kind, null, triggerId, price);
    }

    public static TriggerEvent changed(
            Object source, long positionId, TriggerKind kind, Long oldTriggerId, Long newTriggerId, BigDecimal price) {
        return new TriggerEvent(source, TriggerEventType.CHANGED, positionId, kind, oldTriggerId, newTriggerId, price);
    }

    public static TriggerEvent removed(Object source, long positionId, TriggerKind kind, long triggerId) {
        return new TriggerEvent(source, TriggerEventType.REMOVED, positionId, kind, triggerId, null, null);
    }

    public TriggerEventType getEventType() {
        return eventType;
    }

    public long getPositionId() {
        return positionId;
    }

    public TriggerKind getKind() {
        return kind;
    }

    /** Null when no trigger of this kind was live before the transition. */
    public Long getOldTriggerId() {
        return oldTriggerId;
    }

    /** Null when the transition cleared or removed the trigger. */
    public Long getNewTriggerId() {
        return newTriggerId;
    }

    /** Price of the new trigger; null when no new id was allocated. */
    public BigDecimal getPrice() {
        return price;
    }
}
