package com.marginledger.api.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogResponse {

    private Long id;
    private String eventType;
    private String entityType;
    private String entityId;
    private String action;
    private String oldValue;
    private String newValue;
    private String account;
    private Map<String, Object> context;
    private LocalDateTime timestamp;
}
