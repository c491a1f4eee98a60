package com.marginledger.unit.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marginledger.asset.SimulatedValueTransferGateway;
import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimulatedValueTransferGatewayTest {

    private SimulatedValueTransferGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new SimulatedValueTransferGateway();
        gateway.credit("alice", new BigDecimal("100"));
    }

    @Test
    void pull_movesValueBetweenWallets() {
        assertThat(gateway.pull("alice", "custody", new BigDecimal("40"))).isTrue();

        assertThat(gateway.balanceOf("alice")).isEqualByComparingTo("60");
        assertThat(gateway.balanceOf("custody")).isEqualByComparingTo("40");
    }

    @Test
    void pull_deniedWhenBalanceInsufficient() {
        assertThat(gateway.pull("alice", "custody", new BigDecimal("100.01"))).isFalse();

        assertThat(gateway.balanceOf("alice")).isEqualByComparingTo("100");
        assertThat(gateway.balanceOf("custody")).isEqualByComparingTo("0");
    }

    @Test
    void push_fromEmptyWalletDenied() {
        assertThat(gateway.push("custody", "alice", BigDecimal.ONE)).isFalse();
    }

    @Test
    void credit_rejectsNonPositiveAmount() {
        assertThatThrownBy(() -> gateway.credit("alice", BigDecimal.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reset_clearsAllWallets() {
        gateway.reset();

        assertThat(gateway.balanceOf("alice")).isEqualByComparingTo("0");
    }

    @Test
    void concurrentCreditsAndTransfers_conserveTotalValue() throws Exception {
        int rounds = 50_000;
        gateway.credit("x", new BigDecimal(rounds));
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> credits = executor.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    gateway.credit("x", BigDecimal.ONE);
                }
                return null;
            });
            Future<?> transfers = executor.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    gateway.pull("x", "y", BigDecimal.ONE);
                }
                return null;
            });
            start.countDown();
            credits.get(30, TimeUnit.SECONDS);
            transfers.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(gateway.balanceOf("x").add(gateway.balanceOf("y")))
                .isEqualByComparingTo(new BigDecimal(2 * rounds));
        assertThat(gateway.balanceOf("y")).isEqualByComparingTo(new BigDecimal(rounds));
    }
}
