package com.marginledger.api.controller;

import com.marginledger.api.dto.response.TriggerResponse;
import com.marginledger.mapper.LedgerViewMapper;
import com.marginledger.service.LedgerQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Trigger lookup by id, as used by keepers watching prices. A replaced or removed id is 404.
 */
@RestController
@RequestMapping("/api/triggers")
public class TriggerController {

    private final LedgerQueryService ledgerQueryService;
    private final LedgerViewMapper ledgerViewMapper;

    public TriggerController(LedgerQueryService ledgerQueryService, LedgerViewMapper ledgerViewMapper) {
        this.ledgerQueryService = ledgerQueryService;
        this.ledgerViewMapper = ledgerViewMapper;
    }

    @GetMapping("/{id}")
    public TriggerResponse getTrigger(@PathVariable long id) {
        return ledgerViewMapper.toResponse(ledgerQueryService.getTrigger(id));
    }
}
