package com.marginledger.service;

import com.marginledger.asset.AssetLedger;
import com.marginledger.balance.BalanceBook;
import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.domain.model.LedgerSnapshot;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.domain.model.PositionView;
import com.marginledger.domain.model.Trigger;
import com.marginledger.ledger.LedgerTransactionManager;
import com.marginledger.oms.OrderBook;
import com.marginledger.position.PositionBook;
import com.marginledger.trigger.TriggerRegistry;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Service;

/**
 * Read-only view over the ledger books. Every query runs under the ledger read lock and
 * therefore observes only committed state.
 */
@Service
public class LedgerQueryService {

    private final LedgerTransactionManager ledgerTransactionManager;
    private final OrderBook orderBook;
    private final PositionBook positionBook;
    private final TriggerRegistry triggerRegistry;
    private final BalanceBook balanceBook;
    private final AssetLedger assetLedger;

    public LedgerQueryService(
            LedgerTransactionManager ledgerTransactionManager,
            OrderBook orderBook,
            PositionBook positionBook,
            TriggerRegistry triggerRegistry,
            BalanceBook balanceBook,
            AssetLedger assetLedger) {
        this.ledgerTransactionManager = ledgerTransactionManager;
        this.orderBook = orderBook;
        this.positionBook = positionBook;
        this.triggerRegistry = triggerRegistry;
        this.balanceBook = balanceBook;
        this.assetLedger = assetLedger;
    }

    public Order getOrder(long orderId) {
        return ledgerTransactionManager.read(() -> orderBook.find(orderId));
    }

    public List<Order> getOrdersByAccount(String account) {
        return ledgerTransactionManager.read(() -> orderBook.findByAccount(account));
    }

    public PositionView getPosition(long positionId) {
        return ledgerTransactionManager.read(() -> toView(positionBook.find(positionId)));
    }

    public List<PositionView> getPositionsByAccount(String account) {
        return ledgerTransactionManager.read(() -> positionBook.findByAccount(account).stream()
                .map(this::toView)
                .toList());
    }

    public Trigger getTrigger(long triggerId) {
        return ledgerTransactionManager.read(() -> triggerRegistry.lookup(triggerId));
    }

    public List<Trigger> getTriggersByPosition(long positionId) {
        return ledgerTransactionManager.read(() -> positionBook.findTriggers(positionId));
    }

    public BigDecimal getAccruedCommission(String account) {
        return ledgerTransactionManager.read(() -> balanceBook.getAccruedCommission(account));
    }

    public BigDecimal getPoolBalance() {
        return ledgerTransactionManager.read(balanceBook::getPoolBalance);
    }

    public BigDecimal getCustodiedValue() {
        return ledgerTransactionManager.read(assetLedger::getCustodiedValue);
    }

    /**
     * Decomposes custodied value into the amounts owed by each book.
     */
    public LedgerSnapshot snapshot() {
        return ledgerTransactionManager.read(() -> {
            Collection<Order> orders = orderBook.findAll();
            Collection<Position> positions = positionBook.findAll();
            return LedgerSnapshot.builder()
                    .custodiedValue(assetLedger.getCustodiedValue())
                    .orderMargin(sum(orders, Order::getMargin))
                    .orderCommission(sum(orders, Order::getCommission))
                    .positionMargin(sum(positions, Position::getMargin))
                    .accruedCommission(balanceBook.getTotalAccruedCommission())
                    .poolBalance(balanceBook.getPoolBalance())
                    .liveOrders(orders.size())
                    .livePositions(positions.size())
                    .liveTriggers(triggerRegistry.getLiveCount())
                    .build();
        });
    }

    private PositionView toView(Position position) {
        long positionId = position.getId();
        return PositionView.builder()
                .position(position)
                .stopLossTriggerId(positionBook.findTriggerId(positionId, TriggerKind.STOP_LOSS).orElse(null))
                .takeProfitTriggerId(positionBook.findTriggerId(positionId, TriggerKind.TAKE_PROFIT).orElse(null))
                .liquidationTriggerId(positionBook.findTriggerId(positionId, TriggerKind.LIQUIDATION).orElse(null))
                .build();
    }

    private static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        return items.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
