package com.marginledger.api.controller;

import com.marginledger.api.dto.response.AuditLogResponse;
import com.marginledger.entity.AuditLogEntity;
import com.marginledger.mapper.LedgerViewMapper;
import com.marginledger.service.AuditService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Audit trail queries.
 *
 * <p>GET /api/audit with {@code entityType} + {@code entityId} returns the history of one
 * order, position, account or the pool; with {@code eventType} all rows of that type;
 * with no parameter the 100 most recent rows.
 */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;
    private final LedgerViewMapper ledgerViewMapper;

    public AuditController(AuditService auditService, LedgerViewMapper ledgerViewMapper) {
        this.auditService = auditService;
        this.ledgerViewMapper = ledgerViewMapper;
    }

    @GetMapping
    public List<AuditLogResponse> getAuditLogs(
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) String eventType) {
        List<AuditLogEntity> entries;
        if (entityType != null && entityId != null) {
            entries = auditService.findByEntity(entityType, entityId);
        } else if (eventType != null) {
            entries = auditService.findByEventType(eventType);
        } else {
            entries = auditService.findRecent();
        }
        return ledgerViewMapper.toAuditLogResponses(entries);
    }
}
