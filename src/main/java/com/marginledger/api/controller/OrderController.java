package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.CreateOrderRequest;
import com.marginledger.api.dto.request.ExecuteOrderRequest;
import com.marginledger.api.dto.response.OrderResponse;
import com.marginledger.api.dto.response.PositionResponse;
import com.marginledger.domain.model.Order;
import com.marginledger.domain.model.Position;
import com.marginledger.mapper.LedgerViewMapper;
import com.marginledger.oms.OrderBook;
import com.marginledger.oms.OrderRequest;
import com.marginledger.service.LedgerQueryService;
import com.marginledger.settlement.SettlementEngine;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the order lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders -- lock margin + commission and create an order</li>
 *   <li>GET /api/orders?account= -- orders of an account</li>
 *   <li>GET /api/orders/{id} -- order by id</li>
 *   <li>DELETE /api/orders/{id} -- cancel a conditional order with full refund</li>
 *   <li>POST /api/orders/{id}/execute -- executor converts the order into a position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderBook orderBook;
    private final SettlementEngine settlementEngine;
    private final LedgerQueryService ledgerQueryService;
    private final LedgerViewMapper ledgerViewMapper;

    public OrderController(
            OrderBook orderBook,
            SettlementEngine settlementEngine,
            LedgerQueryService ledgerQueryService,
            LedgerViewMapper ledgerViewMapper) {
        this.orderBook = orderBook;
        this.settlementEngine = settlementEngine;
        this.ledgerQueryService = ledgerQueryService;
        this.ledgerViewMapper = ledgerViewMapper;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Long> createOrder(
            @RequestHeader(ApiHeaders.CALLER) String caller, @RequestBody @Valid CreateOrderRequest request) {
        OrderRequest orderRequest = OrderRequest.builder()
                .account(request.getAccount())
                .assetId(request.getAssetId())
                .direction(request.getDirection())
                .targetPrice(request.getTargetPrice())
                .stopLossPrice(request.getStopLossPrice())
                .takeProfitPrice(request.getTakeProfitPrice())
                .commission(request.getCommission())
                .margin(request.getMargin())
                .size(request.getSize())
                .leverage(request.getLeverage())
                .build();
        long orderId = orderBook.create(orderRequest, caller);
        return Map.of("orderId", orderId);
    }

    @GetMapping
    public List<OrderResponse> getOrders(@RequestParam String account) {
        return ledgerViewMapper.toOrderResponses(ledgerQueryService.getOrdersByAccount(account));
    }

    @GetMapping("/{id}")
    public OrderResponse getOrder(@PathVariable long id) {
        return ledgerViewMapper.toResponse(ledgerQueryService.getOrder(id));
    }

    @DeleteMapping("/{id}")
    public OrderResponse cancelOrder(@RequestHeader(ApiHeaders.CALLER) String caller, @PathVariable long id) {
        Order cancelled = orderBook.cancel(id, caller);
        return ledgerViewMapper.toResponse(cancelled);
    }

    @PostMapping("/{id}/execute")
    @ResponseStatus(HttpStatus.CREATED)
    public PositionResponse executeOrder(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long id,
            @RequestBody @Valid ExecuteOrderRequest request) {
        Position position =
                settlementEngine.executeOrderToPosition(id, request.getOpenPrice(), request.getOpenedAt(), caller);
        return ledgerViewMapper.toResponse(ledgerQueryService.getPosition(position.getId()));
    }
}
