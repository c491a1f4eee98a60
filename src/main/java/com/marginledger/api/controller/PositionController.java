package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.ClosePositionRequest;
import com.marginledger.api.dto.request.TriggerPriceRequest;
import com.marginledger.api.dto.response.CloseSettlementResponse;
import com.marginledger.api.dto.response.PositionResponse;
import com.marginledger.api.dto.response.TriggerChangeResponse;
import com.marginledger.api.dto.response.TriggerResponse;
import com.marginledger.domain.enums.TriggerKind;
import com.marginledger.mapper.LedgerViewMapper;
import com.marginledger.service.LedgerQueryService;
import com.marginledger.settlement.SettlementEngine;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for open positions, their triggers and settlement.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions?account= -- positions of an account</li>
 *   <li>GET /api/positions/{id} -- position with its trigger ids</li>
 *   <li>GET /api/positions/{id}/triggers -- live triggers of a position</li>
 *   <li>PUT /api/positions/{id}/stop-loss -- set, replace or clear (price 0) the stop-loss</li>
 *   <li>PUT /api/positions/{id}/take-profit -- set, replace or clear (price 0) the take-profit</li>
 *   <li>POST /api/positions/{id}/close -- executor settles the position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final SettlementEngine settlementEngine;
    private final LedgerQueryService ledgerQueryService;
    private final LedgerViewMapper ledgerViewMapper;

    public PositionController(
            SettlementEngine settlementEngine,
            LedgerQueryService ledgerQueryService,
            LedgerViewMapper ledgerViewMapper) {
        this.settlementEngine = settlementEngine;
        this.ledgerQueryService = ledgerQueryService;
        this.ledgerViewMapper = ledgerViewMapper;
    }

    @GetMapping
    public List<PositionResponse> getPositions(@RequestParam String account) {
        return ledgerViewMapper.toPositionResponses(ledgerQueryService.getPositionsByAccount(account));
    }

    @GetMapping("/{id}")
    public PositionResponse getPosition(@PathVariable long id) {
        return ledgerViewMapper.toResponse(ledgerQueryService.getPosition(id));
    }

    @GetMapping("/{id}/triggers")
    public List<TriggerResponse> getTriggers(@PathVariable long id) {
        return ledgerViewMapper.toTriggerResponses(ledgerQueryService.getTriggersByPosition(id));
    }

    @PutMapping("/{id}/stop-loss")
    public TriggerChangeResponse setStopLoss(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long id,
            @RequestBody @Valid TriggerPriceRequest request) {
        Optional<Long> triggerId = settlementEngine.setStopLoss(id, request.getPrice(), caller);
        return toChange(id, TriggerKind.STOP_LOSS, triggerId);
    }

    @PutMapping("/{id}/take-profit")
    public TriggerChangeResponse setTakeProfit(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long id,
            @RequestBody @Valid TriggerPriceRequest request) {
        Optional<Long> triggerId = settlementEngine.setTakeProfit(id, request.getPrice(), caller);
        return toChange(id, TriggerKind.TAKE_PROFIT, triggerId);
    }

    @PostMapping("/{id}/close")
    public CloseSettlementResponse closePosition(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable long id,
            @RequestBody @Valid ClosePositionRequest request) {
        return ledgerViewMapper.toResponse(
                settlementEngine.closePosition(id, request.getPnl(), request.getClosingCommission(), caller));
    }

    private static TriggerChangeResponse toChange(long positionId, TriggerKind kind, Optional<Long> triggerId) {
        return TriggerChangeResponse.builder()
                .positionId(positionId)
                .kind(kind)
                .triggerId(triggerId.orElse(null))
                .build();
    }
}
