package com.yoursp.oauthconnect.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.oauthconnect.model.entity.AuditLog;
import com.yoursp.oauthconnect.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Records audit trail entries for account and connection events
 * (registration, login, account linking, tenant creation, integration connect).
 * Call it after the audited transaction has committed; a failing audit write
 * is logged and never breaks the calling flow.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String USER_REGISTERED = "USER_REGISTERED";
    public static final String LOGIN = "LOGIN";
    public static final String ACCOUNT_LINKED = "ACCOUNT_LINKED";
    public static final String TENANT_CREATED = "TENANT_CREATED";
    public static final String INTEGRATION_CONNECTED = "INTEGRATION_CONNECTED";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId     the acting user (nullable for system actions)
     * @param tenantId   the tenant affected, if any
     * @param action     one of the action constants above
     * @param entityType the type of entity affected, e.g. "Tenant", "Integration"
     * @param entityId   the ID of the affected entity
     * @param metadata   arbitrary key-value metadata (serialized as JSONB)
     */
    public void log(UUID userId, Long tenantId, String action, String entityType, String entityId,
            Map<String, Object> metadata) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .userId(userId)
                .tenantId(tenantId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId);
        try {
            entry.metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null);
        } catch (JsonProcessingException e) {
            // keep the entry, drop the metadata
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
        }

        try {
            auditLogRepository.save(entry.build());
            log.debug("Audit logged: action={}, entity={}:{}, user={}", action, entityType, entityId, userId);
        } catch (DataAccessException e) {
            log.warn("Audit write failed for action={}, entity={}:{}: {}", action, entityType, entityId,
                    e.getMessage());
        }
    }
}
