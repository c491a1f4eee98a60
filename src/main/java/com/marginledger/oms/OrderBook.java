package com.marginledger.oms;

import com.marginledger.access.AccessPolicy;
import com.marginledger.asset.AssetLedger;
import com.marginledger.domain.model.Order;
import com.marginledger.event.OrderEvent;
import com.marginledger.event.OrderEventType;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.index.TraderIndex;
import com.marginledger.ledger.LedgerTransaction;
import com.marginledger.ledger.LedgerTransactionManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pending orders and the margin + commission they lock in custody.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #create}: deposit margin + commission, then store and index the order.
 *       A denied deposit leaves no order behind.</li>
 *   <li>{@link #cancel}: conditional (limit) orders only; removes the order and refunds the
 *       full locked amount, since commission on a cancelled order was never earned.</li>
 *   <li>{@link #removeForExecution}: used by the SettlementEngine inside its own transaction
 *       when the order becomes a position. Value stays in custody.</li>
 * </ul>
 *
 * <p>Order ids start at 1 and are never reused.
 */
@Component
public class OrderBook {

    private static final Logger log = LoggerFactory.getLogger(OrderBook.class);

    private final LedgerTransactionManager ledgerTransactionManager;
    private final AssetLedger assetLedger;
    private final TraderIndex traderIndex;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    private final Map<Long, Order> orders = new HashMap<>();
    private long lastIssuedId;

    public OrderBook(
            LedgerTransactionManager ledgerTransactionManager,
            AssetLedger assetLedger,
            TraderIndex traderIndex,
            AccessPolicy accessPolicy,
            Clock clock) {
        this.ledgerTransactionManager = ledgerTransactionManager;
        this.assetLedger = assetLedger;
        this.traderIndex = traderIndex;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    /**
     * Creates an order on behalf of {@code request.account}.
     *
     * @param caller the account invoking the operation; must be the order account or an executor
     * @return the new order id
     */
    public long create(OrderRequest request, String caller) {
        validate(request);
        accessPolicy.requireOwnerOrExecutor(caller, request.getAccount(), "createOrder");

        Order created = ledgerTransactionManager.execute("createOrder", transaction -> {
            long orderId = lastIssuedId + 1;
            if (orders.containsKey(orderId)) {
                throw new BusinessException(ErrorCode.ALREADY_EXISTS, "Order id collision: " + orderId);
            }

            Order order = Order.builder()
                    .id(orderId)
                    .account(request.getAccount())
                    .assetId(request.getAssetId())
                    .direction(request.getDirection())
                    .targetPrice(orZero(request.getTargetPrice()))
                    .stopLossPrice(orZero(request.getStopLossPrice()))
                    .takeProfitPrice(orZero(request.getTakeProfitPrice()))
                    .commission(orZero(request.getCommission()))
                    .margin(request.getMargin())
                    .size(request.getSize())
                    .leverage(request.getLeverage())
                    .createdAt(Instant.now(clock))
                    .build();

            assetLedger.deposit(transaction, order.getAccount(), order.getLockedAmount());

            lastIssuedId = orderId;
            insert(transaction, order);
            transaction.publish(new OrderEvent(this, order, OrderEventType.CREATED));
            return order;
        });

        log.info(
                "Order {} created: {} {} {} margin={} commission={} leverage={}x target={}",
                created.getId(),
                created.getAccount(),
                created.getDirection(),
                created.getAssetId(),
                created.getMargin(),
                created.getCommission(),
                created.getLeverage(),
                created.getTargetPrice());
        return created.getId();
    }

    /**
     * Cancels a conditional order and refunds {@code margin + commission} to its owner.
     */
    public Order cancel(long orderId, String caller) {
        Order cancelled = ledgerTransactionManager.execute("cancelOrder", transaction -> {
            Order order = find(orderId);
            if (!order.isConditional()) {
                throw new BusinessException(
                        ErrorCode.ORDER_NOT_CANCELABLE,
                        "Only conditional orders can be cancelled; order " + orderId + " is a market order",
                        Map.of("orderId", orderId, "account", order.getAccount()));
            }
            accessPolicy.requireOwnerOrExecutor(caller, order.getAccount(), "cancelOrder");

            remove(transaction, order);
            transaction.publish(new OrderEvent(this, order, OrderEventType.CANCELLED));
            assetLedger.release(order.getAccount(), order.getLockedAmount());
            return order;
        });

        log.info("Order {} cancelled by {}, refunded {}", orderId, caller, cancelled.getLockedAmount());
        return cancelled;
    }

    /**
     * Removes an order that is being converted into a position. Must run inside the
     * caller's transaction; the locked value is not released.
     */
    public Order removeForExecution(LedgerTransaction transaction, long orderId) {
        Order order = find(orderId);
        remove(transaction, order);
        transaction.publish(new OrderEvent(this, order, OrderEventType.EXECUTED));
        return order;
    }

    public Order find(long orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        return order;
    }

    public List<Order> findByAccount(String account) {
        return traderIndex.getOrderIds(account).stream().map(orders::get).toList();
    }

    public Collection<Order> findAll() {
        return List.copyOf(orders.values());
    }

    public long getLastIssuedId() {
        return lastIssuedId;
    }

    private void insert(LedgerTransaction transaction, Order order) {
        orders.put(order.getId(), order);
        transaction.onRollback(() -> orders.remove(order.getId()));
        traderIndex.addOrder(transaction, order.getAccount(), order.getId());
    }

    private void remove(LedgerTransaction transaction, Order order) {
        orders.remove(order.getId());
        transaction.onRollback(() -> orders.put(order.getId(), order));
        traderIndex.removeOrder(transaction, order.getAccount(), order.getId());
    }

    private static void validate(OrderRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getAccount() == null || request.getAccount().isBlank()) {
            throw BusinessException.invalidParameter("Order account is required");
        }
        if (request.getAssetId() == null || request.getAssetId().isBlank()) {
            throw BusinessException.invalidParameter("Order asset is required");
        }
        if (request.getDirection() == null) {
            throw BusinessException.invalidParameter("Order direction is required");
        }
        if (request.getMargin() == null || request.getMargin().signum() <= 0) {
            throw BusinessException.invalidParameter("Order margin must be positive");
        }
        if (request.getSize() == null || request.getSize().signum() <= 0) {
            throw BusinessException.invalidParameter("Order size must be positive");
        }
        if (request.getLeverage() < 1) {
            throw BusinessException.invalidParameter("Order leverage must be at least 1");
        }
        requireNonNegative(request.getCommission(), "commission");
        requireNonNegative(request.getTargetPrice(), "target price");
        requireNonNegative(request.getStopLossPrice(), "stop-loss price");
        requireNonNegative(request.getTakeProfitPrice(), "take-profit price");
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            throw BusinessException.invalidParameter("Order " + field + " must not be negative");
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
