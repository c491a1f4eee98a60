package com.marginledger.service;

import com.marginledger.entity.AuditLogEntity;
import com.marginledger.mapper.JsonHelper;
import com.marginledger.repository.jpa.AuditLogJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists the audit trail of committed ledger transitions.
 *
 * <p>Entries are written after the ledger transaction has committed and the lock has
 * been released, so a slow or failing database never blocks or undoes a settlement.
 * A failed write is logged and dropped.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogJpaRepository auditLogJpaRepository;
    private final Clock clock;

    public AuditService(AuditLogJpaRepository auditLogJpaRepository, Clock clock) {
        this.auditLogJpaRepository = auditLogJpaRepository;
        this.clock = clock;
    }

    /**
     * Logs a fully specified audit entry with old/new values, the account concerned and the amounts involved.
     */
    public void log(
            String eventType,
            String entityType,
            String entityId,
            String action,
            String oldValue,
            String newValue,
            String account,
            Map<String, Object> context) {

        AuditLogEntity auditLogEntity = AuditLogEntity.builder()
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .action(action)
                .oldValue(oldValue)
                .newValue(newValue)
                .account(account)
                .contextJson(buildContextJson(context))
                .timestamp(LocalDateTime.now(clock))
                .build();

        try {
            auditLogJpaRepository.save(auditLogEntity);
        } catch (RuntimeException e) {
            log.error("Failed to persist audit entry {} {} {}: {}", eventType, entityType, entityId, e.getMessage());
        }
    }

    public List<AuditLogEntity> findByEntity(String entityType, String entityId) {
        return auditLogJpaRepository.findByEntity(entityType, entityId);
    }

    public List<AuditLogEntity> findByEventType(String eventType) {
        return auditLogJpaRepository.findByEventTypeOrderByIdAsc(eventType);
    }

    public List<AuditLogEntity> findRecent() {
        return auditLogJpaRepository.findTop100ByOrderByIdDesc();
    }

    private String buildContextJson(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return null;
        }
        try {
            return JsonHelper.toJson(context);
        } catch (Exception e) {
            log.warn("Failed to serialize audit context to JSON: {}", e.getMessage());
            return null;
        }
    }
}
