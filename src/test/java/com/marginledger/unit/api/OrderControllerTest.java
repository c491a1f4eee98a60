package com.marginledger.unit.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.controller.OrderController;
import com.marginledger.domain.enums.Direction;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.domain.model.PositionView;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.GlobalExceptionHandler;
import com.marginledger.exception.NotAuthorizedException;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.mapper.LedgerViewMapper;
import com.marginledger.oms.OrderBook;
import com.marginledger.oms.OrderRequest;
import com.marginledger.service.LedgerQueryService;
import com.marginledger.settlement.SettlementEngine;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for OrderController.
 *
 * <p>Verifies: order creation (201 with the new id), caller header propagation,
 * request validation, cancellation and execution, and error mapping.
 */
class OrderControllerTest {

    private static final String MARKET_ORDER_JSON = """
            {"account":"alice","assetId":"BTC-USD","direction":"LONG","commission":10,
             "margin":1000,"size":10000,"leverage":10}
            """;

    private MockMvc mockMvc;

    @Mock
    private OrderBook orderBook;

    @Mock
    private SettlementEngine settlementEngine;

    @Mock
    private LedgerQueryService ledgerQueryService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        OrderController controller = new OrderController(
                orderBook, settlementEngine, ledgerQueryService, Mappers.getMapper(LedgerViewMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Order order(long id, BigDecimal targetPrice) {
        return Order.builder()
                .id(id)
                .account("alice")
                .assetId("BTC-USD")
                .direction(Direction.LONG)
                .targetPrice(targetPrice)
                .stopLossPrice(BigDecimal.ZERO)
                .takeProfitPrice(BigDecimal.ZERO)
                .commission(new BigDecimal("10"))
                .margin(new BigDecimal("1000"))
                .size(new BigDecimal("10000"))
                .leverage(10)
                .createdAt(Instant.parse("2026-01-05T09:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("POST /api/orders")
    class Create {

        @Test
        @DisplayName("returns 201 with the new order id")
        void createReturnsId() throws Exception {
            when(orderBook.create(any(OrderRequest.class), eq("alice"))).thenReturn(1L);

            mockMvc.perform(post("/api/orders")
                            .header("X-Account", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(MARKET_ORDER_JSON))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.orderId").value(1));
        }

        @Test
        @DisplayName("copies request fields into the order request")
        void requestFieldsCopied() throws Exception {
            when(orderBook.create(any(OrderRequest.class), anyString())).thenReturn(1L);

            mockMvc.perform(post("/api/orders")
                            .header("X-Account", "executor-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(MARKET_ORDER_JSON))
                    .andExpect(status().isCreated());

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(orderBook).create(captor.capture(), eq("executor-1"));
            OrderRequest request = captor.getValue();
            assertThat(request.getAccount()).isEqualTo("alice");
            assertThat(request.getDirection()).isEqualTo(Direction.LONG);
            assertThat(request.getMargin()).isEqualByComparingTo("1000");
            assertThat(request.getLeverage()).isEqualTo(10);
            assertThat(request.getTargetPrice()).isNull();
        }

        @Test
        @DisplayName("missing caller header returns 400")
        void missingCallerHeader() throws Exception {
            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(MARKET_ORDER_JSON))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

            verifyNoInteractions(orderBook);
        }

        @Test
        @DisplayName("zero leverage fails validation")
        void zeroLeverageRejected() throws Exception {
            mockMvc.perform(post("/api/orders")
                            .header("X-Account", "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"account":"alice","assetId":"BTC-USD","direction":"LONG","margin":1000,
                             "size":10000,"leverage":0}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.leverage").exists());

            verifyNoInteractions(orderBook);
        }

        @Test
        @DisplayName("caller who is not the owner gets 403")
        void foreignCallerForbidden() throws Exception {
            when(orderBook.create(any(OrderRequest.class), eq("bob")))
                    .thenThrow(new NotAuthorizedException("bob may not act for alice"));

            mockMvc.perform(post("/api/orders")
                            .header("X-Account", "bob")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(MARKET_ORDER_JSON))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("GET by id returns the order with derived fields")
        void getById() throws Exception {
            when(ledgerQueryService.getOrder(3L)).thenReturn(order(3, new BigDecimal("95")));

            mockMvc.perform(get("/api/orders/3"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(3))
                    .andExpect(jsonPath("$.conditional").value(true))
                    .andExpect(jsonPath("$.lockedAmount").value(1010));
        }

        @Test
        @DisplayName("unknown order returns 404")
        void unknownOrder() throws Exception {
            when(ledgerQueryService.getOrder(42L)).thenThrow(new ResourceNotFoundException("Order", 42L));

            mockMvc.perform(get("/api/orders/42"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("GET by account lists that account's orders")
        void byAccount() throws Exception {
            when(ledgerQueryService.getOrdersByAccount("alice"))
                    .thenReturn(List.of(order(1, BigDecimal.ZERO), order(2, new BigDecimal("95"))));

            mockMvc.perform(get("/api/orders").param("account", "alice"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[0].conditional").value(false))
                    .andExpect(jsonPath("$[1].id").value(2));
        }
    }

    @Nested
    @DisplayName("DELETE /api/orders/{id}")
    class Cancel {

        @Test
        @DisplayName("returns the cancelled order")
        void cancelReturnsOrder() throws Exception {
            when(orderBook.cancel(2L, "alice")).thenReturn(order(2, new BigDecimal("95")));

            mockMvc.perform(delete("/api/orders/2").header("X-Account", "alice"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(2))
                    .andExpect(jsonPath("$.lockedAmount").value(1010));
        }

        @Test
        @DisplayName("market order cancellation maps to 409")
        void marketOrderNotCancelable() throws Exception {
            when(orderBook.cancel(1L, "alice"))
                    .thenThrow(new BusinessException(ErrorCode.ORDER_NOT_CANCELABLE, "Order 1 is not conditional"));

            mockMvc.perform(delete("/api/orders/1").header("X-Account", "alice"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("ORDER_NOT_CANCELABLE"));
        }
    }

    @Nested
    @DisplayName("POST /api/orders/{id}/execute")
    class Execute {

        @Test
        @DisplayName("returns 201 with the opened position and its liquidation trigger")
        void executeReturnsPosition() throws Exception {
            Instant openedAt = Instant.parse("2026-01-05T09:00:30Z");
            Position position = Position.builder()
                    .id(1)
                    .account("alice")
                    .assetId("BTC-USD")
                    .direction(Direction.LONG)
                    .openPrice(new BigDecimal("100"))
                    .margin(new BigDecimal("1000"))
                    .size(new BigDecimal("10000"))
                    .leverage(10)
                    .openedAt(openedAt)
                    .sourceOrderId(1)
                    .build();
            when(settlementEngine.executeOrderToPosition(eq(1L), any(BigDecimal.class), eq(openedAt), eq("executor-1")))
                    .thenReturn(position);
            when(ledgerQueryService.getPosition(1L))
                    .thenReturn(PositionView.builder().position(position).liquidationTriggerId(1L).build());

            mockMvc.perform(post("/api/orders/1/execute")
                            .header("X-Account", "executor-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"openPrice":100,"openedAt":"2026-01-05T09:00:30Z"}
                            """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(1))
                    .andExpect(jsonPath("$.sourceOrderId").value(1))
                    .andExpect(jsonPath("$.liquidationTriggerId").value(1));
        }

        @Test
        @DisplayName("missing open time fails validation")
        void missingOpenTime() throws Exception {
            mockMvc.perform(post("/api/orders/1/execute")
                            .header("X-Account", "executor-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"openPrice":100}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.openedAt").exists());

            verifyNoInteractions(settlementEngine);
        }
    }
}
