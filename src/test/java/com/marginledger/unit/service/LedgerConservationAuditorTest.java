package com.marginledger.unit.service;

import static com.marginledger.support.LedgerFixture.EXECUTOR;
import static com.marginledger.support.LedgerFixture.marketOrder;
import static org.assertj.core.api.Assertions.assertThat;

import com.marginledger.domain.enums.Direction;
import com.marginledger.domain.model.LedgerSnapshot;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.exception.BaseException;
import com.marginledger.service.LedgerConservationAuditor;
import com.marginledger.support.LedgerFixture;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LedgerConservationAuditorTest {

    private static final List<String> TRADERS = List.of("t1", "t2", "t3", "t4");

    private LedgerFixture ledger;
    private LedgerConservationAuditor auditor;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        auditor = new LedgerConservationAuditor(ledger.queryService);
    }

    @Test
    @DisplayName("snapshot decomposes custodied value into its components")
    void snapshotDecomposes() {
        ledger.fundPool("200");
        ledger.openDefaultPosition("t1", "100");
        ledger.credit("t2", "505");
        ledger.createOrder(marketOrder("t2")
                .margin(new BigDecimal("500"))
                .commission(new BigDecimal("5"))
                .build());

        LedgerSnapshot snapshot = auditor.check();

        assertThat(snapshot.getCustodiedValue()).isEqualByComparingTo("1715");
        assertThat(snapshot.getPoolBalance()).isEqualByComparingTo("200");
        assertThat(snapshot.getPositionMargin()).isEqualByComparingTo("1000");
        assertThat(snapshot.getAccruedCommission()).isEqualByComparingTo("10");
        assertThat(snapshot.getOrderMargin()).isEqualByComparingTo("500");
        assertThat(snapshot.getOrderCommission()).isEqualByComparingTo("5");
        assertThat(snapshot.getLiveOrders()).isEqualTo(1);
        assertThat(snapshot.getLivePositions()).isEqualTo(1);
        assertThat(snapshot.getLiveTriggers()).isEqualTo(1);
        assertThat(snapshot.isBalanced()).isTrue();
        assertThat(auditor.getViolationCount()).isZero();
        assertThat(auditor.getLastSnapshot()).isSameAs(snapshot);
    }

    @Test
    @DisplayName("a violation is counted")
    void violationCounted() {
        ledger.openDefaultPosition("t1", "100");
        // value leaving custody without a ledger operation
        ledger.assetLedger.release("t1", new BigDecimal("1"));

        LedgerSnapshot snapshot = auditor.check();

        assertThat(snapshot.isBalanced()).isFalse();
        assertThat(auditor.getViolationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("conservation holds across a random sequence of operations, including rejected ones")
    void conservationUnderRandomOperations() {
        Random random = new Random(20260105L);
        ledger.fundPool("5000");
        TRADERS.forEach(trader -> ledger.credit(trader, "100000"));

        for (int step = 0; step < 400; step++) {
            try {
                applyRandomOperation(random);
            } catch (BaseException expected) {
                // rejected operations must leave the ledger untouched
            }
            assertThat(auditor.check().isBalanced())
                    .as("balanced after step %d", step)
                    .isTrue();
        }
        assertThat(auditor.getViolationCount()).isZero();
    }

    private void applyRandomOperation(Random random) {
        String trader = TRADERS.get(random.nextInt(TRADERS.size()));
        List<Order> orders = new ArrayList<>(ledger.orderBook.findAll());
        List<Position> positions = new ArrayList<>(ledger.positionBook.findAll());

        switch (random.nextInt(6)) {
            case 0 -> ledger.createOrder(marketOrder(trader)
                    .direction(random.nextBoolean() ? Direction.LONG : Direction.SHORT)
                    .targetPrice(random.nextBoolean() ? BigDecimal.ZERO : amount(random, 50, 150))
                    .margin(amount(random, 10, 2000))
                    .commission(amount(random, 0, 20))
                    .leverage(1 + random.nextInt(50))
                    .build());
            case 1 -> {
                if (!orders.isEmpty()) {
                    Order order = orders.get(random.nextInt(orders.size()));
                    ledger.orderBook.cancel(order.getId(), order.getAccount());
                }
            }
            case 2 -> {
                if (!orders.isEmpty()) {
                    ledger.execute(orders.get(random.nextInt(orders.size())).getId(), amount(random, 50, 150).toPlainString());
                }
            }
            case 3 -> {
                if (!positions.isEmpty()) {
                    Position position = positions.get(random.nextInt(positions.size()));
                    BigDecimal pnl = amount(random, 0, 3000).subtract(new BigDecimal("1500"));
                    BigDecimal commission = amount(random, 0, 30);
                    ledger.settlementEngine.closePosition(position.getId(), pnl, commission, EXECUTOR);
                }
            }
            case 4 -> {
                if (!positions.isEmpty()) {
                    Position position = positions.get(random.nextInt(positions.size()));
                    ledger.settlementEngine.setStopLoss(position.getId(), amount(random, 0, 100), position.getAccount());
                }
            }
            default -> ledger.balanceBook.withdrawCommission(LedgerFixture.COMMISSION_RECEIVER);
        }
    }

    private static BigDecimal amount(Random random, int min, int max) {
        return BigDecimal.valueOf(min * 100L + random.nextInt((max - min) * 100 + 1), 2);
    }
}
