package com.marginledger.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.event.OrderEvent;
import com.marginledger.event.OrderEventType;
import com.marginledger.event.PositionEvent;
import com.marginledger.event.PositionEventType;
import com.marginledger.event.TriggerEvent;
import com.marginledger.observability.LedgerMetricsService;
import com.marginledger.service.LedgerConservationAuditor;
import com.marginledger.service.LedgerQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for LedgerMetricsService. Lenient strictness because gauge suppliers are only
 * polled by the nested tests that read them.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LedgerMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private LedgerMetricsService ledgerMetricsService;

    @Mock
    private LedgerQueryService ledgerQueryService;

    @Mock
    private LedgerConservationAuditor ledgerConservationAuditor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(ledgerQueryService.getPoolBalance()).thenReturn(new BigDecimal("150.5"));
        when(ledgerQueryService.getCustodiedValue()).thenReturn(new BigDecimal("1160"));
        when(ledgerConservationAuditor.getViolationCount()).thenReturn(0L);
        ledgerMetricsService = new LedgerMetricsService(meterRegistry, ledgerQueryService, ledgerConservationAuditor);
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("ledger.orders counts each order transition by tag")
        void orderCountersByTag() {
            Order order = Order.builder().id(1).build();

            ledgerMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.CREATED));
            ledgerMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.CREATED));
            ledgerMetricsService.onOrderEvent(new OrderEvent(this, order, OrderEventType.EXECUTED));

            assertThat(meterRegistry.get("ledger.orders").tag("event", "CREATED").counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("ledger.orders").tag("event", "EXECUTED").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("ledger.orders").tag("event", "CANCELLED").counter().count())
                    .isZero();
        }

        @Test
        @DisplayName("ledger.positions counts opened and closed")
        void positionCounters() {
            Position position = Position.builder().id(1).build();

            ledgerMetricsService.onPositionEvent(new PositionEvent(this, position, PositionEventType.OPENED));

            assertThat(meterRegistry.get("ledger.positions").tag("event", "OPENED").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("ledger.triggers.set ignores CHANGED and REMOVED")
        void triggersSetOnly() {
            ledgerMetricsService.onTriggerEvent(TriggerEvent.set(this, 1, TriggerKind.STOP_LOSS, 1, BigDecimal.TEN));
            ledgerMetricsService.onTriggerEvent(
                    TriggerEvent.changed(this, 1, TriggerKind.STOP_LOSS, 1L, null, null));
            ledgerMetricsService.onTriggerEvent(TriggerEvent.removed(this, 1, TriggerKind.LIQUIDATION, 2));

            assertThat(meterRegistry.get("ledger.triggers.set").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauge metrics")
    class GaugeMetrics {

        @Test
        @DisplayName("pool and custody gauges read the ledger lazily")
        void balanceGauges() {
            assertThat(meterRegistry.get("ledger.pool.balance").gauge().value()).isEqualTo(150.5);
            assertThat(meterRegistry.get("ledger.custody.value").gauge().value()).isEqualTo(1160.0);
        }

        @Test
        @DisplayName("conservation violations gauge follows the auditor")
        void violationGauge() {
            when(ledgerConservationAuditor.getViolationCount()).thenReturn(3L);

            assertThat(meterRegistry.get("ledger.conservation.violations").gauge().value())
                    .isEqualTo(3.0);
        }
    }
}
