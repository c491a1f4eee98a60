package com.marginledger.trigger;

import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.domain.model.Trigger;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.ledger.LedgerTransaction;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the trigger id space shared by stop-loss, take-profit and liquidation triggers.
 *
 * <p>Invariants:
 * <ul>
 *   <li>Ids come from one counter and are strictly increasing; an id is never issued twice,
 *       including ids consumed by a transaction that was rolled back</li>
 *   <li>A record and its reverse entry (position → kind → id) are added and erased together</li>
 *   <li>At most one live trigger per (position, kind)</li>
 *   <li>There is no in-place price update: replace means deallocate + allocate</li>
 * </ul>
 *
 * <p>All mutators must run inside a {@link LedgerTransaction}; each registers the inverse
 * operation so a failed transaction leaves no dangling record or reverse entry.
 */
@Component
public class TriggerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TriggerRegistry.class);

    private final Map<Long, Trigger> triggers = new HashMap<>();
    private final Map<Long, EnumMap<TriggerKind, Long>> triggersByPosition = new HashMap<>();

    private long lastIssuedId;

    public long allocate(LedgerTransaction transaction, long positionId, TriggerKind kind, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw BusinessException.invalidParameter("Trigger price must be positive");
        }
        if (findId(positionId, kind).isPresent()) {
            throw new BusinessException(
                    ErrorCode.ALREADY_EXISTS,
                    String.format("Position %d already has a live %s trigger", positionId, kind));
        }

        long triggerId = ++lastIssuedId;
        if (triggers.containsKey(triggerId)) {
            throw new BusinessException(ErrorCode.ALREADY_EXISTS, "Trigger id collision: " + triggerId);
        }

        Trigger trigger = Trigger.builder()
                .id(triggerId)
                .positionId(positionId)
                .kind(kind)
                .price(price)
                .build();
        insert(trigger);
        transaction.onRollback(() -> erase(trigger));

        log.debug("Allocated {} trigger {} for position {} @ {}", kind, triggerId, positionId, price);
        return triggerId;
    }

    public Trigger deallocate(LedgerTransaction transaction, long triggerId) {
        Trigger trigger = lookup(triggerId);
        erase(trigger);
        transaction.onRollback(() -> insert(trigger));

        log.debug("Deallocated {} trigger {} of position {}", trigger.getKind(), triggerId, trigger.getPositionId());
        return trigger;
    }

    public Trigger lookup(long triggerId) {
        Trigger trigger = triggers.get(triggerId);
        if (trigger == null) {
            throw new ResourceNotFoundException("Trigger", triggerId);
        }
        return trigger;
    }

    public Optional<Long> findId(long positionId, TriggerKind kind) {
        EnumMap<TriggerKind, Long> byKind = triggersByPosition.get(positionId);
        return byKind == null ? Optional.empty() : Optional.ofNullable(byKind.get(kind));
    }

    /** Live triggers of a position, ordered by kind. */
    public List<Trigger> findByPosition(long positionId) {
        EnumMap<TriggerKind, Long> byKind = triggersByPosition.get(positionId);
        if (byKind == null) {
            return List.of();
        }
        return byKind.values().stream().map(triggers::get).toList();
    }

    public long getLastIssuedId() {
        return lastIssuedId;
    }

    public int getLiveCount() {
        return triggers.size();
    }

    private void insert(Trigger trigger) {
        triggers.put(trigger.getId(), trigger);
        triggersByPosition
                .computeIfAbsent(trigger.getPositionId(), k -> new EnumMap<>(TriggerKind.class))
                .put(trigger.getKind(), trigger.getId());
    }

    private void erase(Trigger trigger) {
        triggers.remove(trigger.getId());
        EnumMap<TriggerKind, Long> byKind = triggersByPosition.get(trigger.getPositionId());
        if (byKind != null) {
            byKind.remove(trigger.getKind());
            if (byKind.isEmpty()) {
                triggersByPosition.remove(trigger.getPositionId());
            }
        }
    }
}
