package com.marginledger.repository.jpa;

import com.marginledger.entity.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the audit_logs table.
 */
@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByEventTypeOrderByIdAsc(String eventType);

    List<AuditLogEntity> findTop100ByOrderByIdDesc();

    @Query("SELECT a FROM AuditLogEntity a WHERE a.entityType = :entityType AND a.entityId = :entityId ORDER BY a.id ASC")
    List<AuditLogEntity> findByEntity(@Param("entityType") String entityType, @Param("entityId") String entityId);
}
