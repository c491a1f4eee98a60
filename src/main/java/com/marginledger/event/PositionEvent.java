package com.marginledger.event;

import com.marginledger.domain.model.CloseSettlement;
import com.marginledger.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a position is opened from an order or closed with settlement.
 * CLOSED events carry the {@link CloseSettlement} (payout, signed pool delta).
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final CloseSettlement settlement;

    public PositionEvent(Object source, Position position, PositionEventType eventType, CloseSettlement settlement) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.settlement = settlement;
    }

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        this(source, position, eventType, null);
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    /** Null for OPENED events. */
    public CloseSettlement getSettlement() {
        return settlement;
    }
}
