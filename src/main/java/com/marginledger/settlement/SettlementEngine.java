package com.marginledger.settlement;

import com.marginledger.access.AccessPolicy;
import com.marginledger.asset.AssetLedger;
import com.marginledger.balance.BalanceBook;
import com.marginledger.config.LedgerProperties;
import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.domain.model.CloseSettlement;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.event.PositionEvent;
import com.marginledger.event.PositionEventType;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.ledger.LedgerTransactionManager;
import com.marginledger.oms.OrderBook;
import com.marginledger.position.PositionBook;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives the order → position → settlement lifecycle.
 *
 * <p>Each public method is one ledger transaction. Steps that move value out of custody
 * run last, after every book mutation and event has been staged, so a denied release
 * rolls back the whole operation.
 *
 * <p>Settlement rules for {@link #closePosition}, with {@code marginNet = margin − closingCommission}:
 * <ul>
 *   <li>pnl &gt; 0: the pool pays the profit; the trader receives {@code marginNet + pnl}</li>
 *   <li>pnl &lt; 0: the pool absorbs {@code min(loss, marginNet)}; the trader receives the rest
 *       of the net margin, if any. Loss beyond the net margin is reported, never collected.</li>
 *   <li>pnl = 0: the trader receives {@code marginNet}</li>
 * </ul>
 */
@Service
public class SettlementEngine {

    private static final Logger log = LoggerFactory.getLogger(SettlementEngine.class);

    private final LedgerTransactionManager ledgerTransactionManager;
    private final OrderBook orderBook;
    private final PositionBook positionBook;
    private final BalanceBook balanceBook;
    private final AssetLedger assetLedger;
    private final LiquidationPriceCalculator liquidationPriceCalculator;
    private final AccessPolicy accessPolicy;
    private final String commissionReceiver;

    public SettlementEngine(
            LedgerTransactionManager ledgerTransactionManager,
            OrderBook orderBook,
            PositionBook positionBook,
            BalanceBook balanceBook,
            AssetLedger assetLedger,
            LiquidationPriceCalculator liquidationPriceCalculator,
            AccessPolicy accessPolicy,
            LedgerProperties ledgerProperties) {
        this.ledgerTransactionManager = ledgerTransactionManager;
        this.orderBook = orderBook;
        this.positionBook = positionBook;
        this.balanceBook = balanceBook;
        this.assetLedger = assetLedger;
        this.liquidationPriceCalculator = liquidationPriceCalculator;
        this.accessPolicy = accessPolicy;
        this.commissionReceiver = ledgerProperties.getCommissionReceiver();
    }

    /**
     * Converts a pending order into an open position at the attested fill price and time.
     * The order margin becomes position margin without leaving custody; the order
     * commission is earned by the commission receiver.
     */
    public Position executeOrderToPosition(long orderId, BigDecimal openPrice, Instant openedAt, String caller) {
        accessPolicy.requireExecutor(caller, "executeOrderToPosition");
        if (openPrice == null || openPrice.signum() <= 0) {
            throw BusinessException.invalidParameter("Open price must be positive");
        }
        if (openedAt == null || !openedAt.isAfter(Instant.EPOCH)) {
            throw BusinessException.invalidParameter("Open time must be after the epoch");
        }

        Position opened = ledgerTransactionManager.execute("executeOrderToPosition", transaction -> {
            Order order = orderBook.find(orderId);
            if (openedAt.isBefore(order.getCreatedAt())) {
                throw BusinessException.invalidParameter(String.format(
                        "Open time %s precedes creation of order %d at %s", openedAt, orderId, order.getCreatedAt()));
            }

            orderBook.removeForExecution(transaction, orderId);
            balanceBook.creditCommission(transaction, commissionReceiver, order.getCommission());

            Position position = positionBook.open(transaction, order, openPrice, openedAt);
            long positionId = position.getId();

            if (order.getStopLossPrice().signum() > 0) {
                positionBook.attachTrigger(transaction, positionId, TriggerKind.STOP_LOSS, order.getStopLossPrice());
            }
            if (order.getTakeProfitPrice().signum() > 0) {
                positionBook.attachTrigger(
                        transaction, positionId, TriggerKind.TAKE_PROFIT, order.getTakeProfitPrice());
            }
            BigDecimal liquidationPrice =
                    liquidationPriceCalculator.calculate(position.getDirection(), openPrice, position.getLeverage());
            positionBook.attachTrigger(transaction, positionId, TriggerKind.LIQUIDATION, liquidationPrice);

            transaction.publish(new PositionEvent(this, position, PositionEventType.OPENED));
            return position;
        });

        log.info(
                "Order {} executed as position {}: {} {} @ {} margin={} leverage={}x",
                orderId,
                opened.getId(),
                opened.getDirection(),
                opened.getAssetId(),
                openPrice,
                opened.getMargin(),
                opened.getLeverage());
        return opened;
    }

    /**
     * Sets, replaces or (with a zero price) clears the stop-loss trigger of a position.
     *
     * @return the new trigger id, or empty when cleared
     */
    public Optional<Long> setStopLoss(long positionId, BigDecimal price, String caller) {
        return replaceTrigger(positionId, TriggerKind.STOP_LOSS, price, caller, "setStopLoss");
    }

    /**
     * Sets, replaces or (with a zero price) clears the take-profit trigger of a position.
     *
     * @return the new trigger id, or empty when cleared
     */
    public Optional<Long> setTakeProfit(long positionId, BigDecimal price, String caller) {
        return replaceTrigger(positionId, TriggerKind.TAKE_PROFIT, price, caller, "setTakeProfit");
    }

    /**
     * Closes a position with an attested pnl and closing commission and pays out the
     * trader's share of the margin.
     */
    public CloseSettlement closePosition(long positionId, BigDecimal pnl, BigDecimal closingCommission, String caller) {
        accessPolicy.requireExecutor(caller, "closePosition");
        if (pnl == null) {
            throw BusinessException.invalidParameter("Pnl is required");
        }
        if (closingCommission == null || closingCommission.signum() < 0) {
            throw BusinessException.invalidParameter("Closing commission must not be negative");
        }

        CloseSettlement settlement = ledgerTransactionManager.execute("closePosition", transaction -> {
            Position position = positionBook.find(positionId);
            if (closingCommission.compareTo(position.getMargin()) > 0) {
                throw new InsufficientFundsException(
                        "Closing commission exceeds margin of position " + positionId,
                        position.getMargin(),
                        closingCommission);
            }
            if (pnl.signum() > 0) {
                balanceBook.requirePoolCovers(pnl);
            }

            positionBook.remove(transaction, positionId);
            balanceBook.creditCommission(transaction, commissionReceiver, closingCommission);

            BigDecimal marginNet = position.getMargin().subtract(closingCommission);
            BigDecimal payout;
            BigDecimal poolDelta;
            BigDecimal uncollectedLoss = BigDecimal.ZERO;

            if (pnl.signum() > 0) {
                balanceBook.debitPool(transaction, pnl);
                poolDelta = pnl.negate();
                payout = marginNet.add(pnl);
            } else if (pnl.signum() < 0) {
                BigDecimal loss = pnl.negate();
                BigDecimal absorbed = loss.min(marginNet);
                balanceBook.creditPool(transaction, absorbed);
                poolDelta = absorbed;
                payout = marginNet.subtract(absorbed);
                uncollectedLoss = loss.subtract(absorbed);
            } else {
                poolDelta = BigDecimal.ZERO;
                payout = marginNet;
            }

            CloseSettlement result = CloseSettlement.builder()
                    .positionId(positionId)
                    .account(position.getAccount())
                    .pnl(pnl)
                    .closingCommission(closingCommission)
                    .marginNet(marginNet)
                    .payout(payout)
                    .poolDelta(poolDelta)
                    .uncollectedLoss(uncollectedLoss)
                    .build();
            transaction.publish(new PositionEvent(this, position, PositionEventType.CLOSED, result));

            if (payout.signum() > 0) {
                assetLedger.release(position.getAccount(), payout);
            }
            return result;
        });

        if (settlement.getUncollectedLoss().signum() > 0) {
            log.warn(
                    "Position {} closed with uncollected loss {} beyond net margin {}",
                    positionId,
                    settlement.getUncollectedLoss(),
                    settlement.getMarginNet());
        }
        log.info(
                "Position {} closed: pnl={} commission={} payout={} poolDelta={}",
                positionId,
                pnl,
                closingCommission,
                settlement.getPayout(),
                settlement.getPoolDelta());
        return settlement;
    }

    private Optional<Long> replaceTrigger(
            long positionId, TriggerKind kind, BigDecimal price, String caller, String operation) {
        if (price == null || price.signum() < 0) {
            throw BusinessException.invalidParameter(kind + " price must not be negative");
        }

        Optional<Long> newId = ledgerTransactionManager.execute(operation, transaction -> {
            Position position = positionBook.find(positionId);
            accessPolicy.requireOwnerOrExecutor(caller, position.getAccount(), operation);
            return positionBook.replaceTrigger(transaction, positionId, kind, price);
        });

        log.info(
                "{} of position {} {} by {}",
                kind,
                positionId,
                newId.map(id -> "set to " + price + " (trigger " + id + ")").orElse("cleared"),
                caller);
        return newId;
    }
}
