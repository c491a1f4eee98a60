package com.marginledger.position;

import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.domain.model.Trigger;
import com.marginledger.event.TriggerEvent;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.index.TraderIndex;
import com.marginledger.ledger.LedgerTransaction;
import com.marginledger.trigger.TriggerRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Open positions, their immobilized margin and the triggers attached to them.
 *
 * <p>PositionBook has no transactions of its own: every mutator takes the
 * {@link LedgerTransaction} of the SettlementEngine operation driving it. Trigger ids are
 * kept in the {@link TriggerRegistry}; this book enforces which kinds may be replaced.
 */
@Component
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final TriggerRegistry triggerRegistry;
    private final TraderIndex traderIndex;

    private final Map<Long, Position> positions = new HashMap<>();
    private long lastIssuedId;

    public PositionBook(TriggerRegistry triggerRegistry, TraderIndex traderIndex) {
        this.triggerRegistry = triggerRegistry;
        this.traderIndex = traderIndex;
    }

    /**
     * Opens a position from an order that has already been removed from the OrderBook.
     * The order's margin becomes the position margin without leaving custody.
     */
    public Position open(LedgerTransaction transaction, Order order, BigDecimal openPrice, Instant openedAt) {
        long positionId = ++lastIssuedId;
        if (positions.containsKey(positionId)) {
            throw new BusinessException(ErrorCode.ALREADY_EXISTS, "Position id collision: " + positionId);
        }

        Position position = Position.builder()
                .id(positionId)
                .account(order.getAccount())
                .assetId(order.getAssetId())
                .direction(order.getDirection())
                .openPrice(openPrice)
                .margin(order.getMargin())
                .size(order.getSize())
                .leverage(order.getLeverage())
                .openedAt(openedAt)
                .sourceOrderId(order.getId())
                .build();

        positions.put(positionId, position);
        transaction.onRollback(() -> positions.remove(positionId));
        traderIndex.addPosition(transaction, position.getAccount(), positionId);

        log.debug("Position {} opened from order {}", positionId, order.getId());
        return position;
    }

    /**
     * Removes a position and erases every live trigger attached to it.
     */
    public Position remove(LedgerTransaction transaction, long positionId) {
        Position position = find(positionId);

        for (Trigger trigger : triggerRegistry.findByPosition(positionId)) {
            triggerRegistry.deallocate(transaction, trigger.getId());
            transaction.publish(TriggerEvent.removed(this, positionId, trigger.getKind(), trigger.getId()));
        }

        positions.remove(positionId);
        transaction.onRollback(() -> positions.put(positionId, position));
        traderIndex.removePosition(transaction, position.getAccount(), positionId);

        log.debug("Position {} removed", positionId);
        return position;
    }

    /**
     * Allocates a trigger for a position that has none of this kind yet.
     */
    public long attachTrigger(LedgerTransaction transaction, long positionId, TriggerKind kind, BigDecimal price) {
        find(positionId);
        long triggerId = triggerRegistry.allocate(transaction, positionId, kind, price);
        transaction.publish(TriggerEvent.set(this, positionId, kind, triggerId, price));
        return triggerId;
    }

    /**
     * Replaces a stop-loss or take-profit trigger. A zero price clears the trigger.
     * Emits CHANGED (old → new) and, when a new id was allocated, SET.
     *
     * @return the new trigger id, or empty when the trigger was cleared
     */
    public Optional<Long> replaceTrigger(
            LedgerTransaction transaction, long positionId, TriggerKind kind, BigDecimal price) {
        if (!kind.isReplaceable()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, kind + " trigger is immutable once set for a position");
        }
        if (price == null || price.signum() < 0) {
            throw BusinessException.invalidParameter("Trigger price must not be negative");
        }
        find(positionId);

        Long oldId = triggerRegistry.findId(positionId, kind).orElse(null);
        if (oldId != null) {
            triggerRegistry.deallocate(transaction, oldId);
        }

        Long newId = null;
        if (price.signum() > 0) {
            newId = triggerRegistry.allocate(transaction, positionId, kind, price);
        }

        transaction.publish(TriggerEvent.changed(this, positionId, kind, oldId, newId, newId != null ? price : null));
        if (newId != null) {
            transaction.publish(TriggerEvent.set(this, positionId, kind, newId, price));
        }
        return Optional.ofNullable(newId);
    }

    public Position find(long positionId) {
        Position position = positions.get(positionId);
        if (position == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        return position;
    }

    public List<Position> findByAccount(String account) {
        return traderIndex.getPositionIds(account).stream().map(positions::get).toList();
    }

    public Collection<Position> findAll() {
        return List.copyOf(positions.values());
    }

    public List<Trigger> findTriggers(long positionId) {
        find(positionId);
        return triggerRegistry.findByPosition(positionId);
    }

    public Optional<Long> findTriggerId(long positionId, TriggerKind kind) {
        return triggerRegistry.findId(positionId, kind);
    }

    public long getLastIssuedId() {
        return lastIssuedId;
    }
}
