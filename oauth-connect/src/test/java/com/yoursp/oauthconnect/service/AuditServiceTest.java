package com.yoursp.oauthconnect.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.oauthconnect.model.entity.AuditLog;
import com.yoursp.oauthconnect.repository.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditLogRepository, new ObjectMapper());
    }

    @Test
    @DisplayName("Entry carries user, tenant, action and JSON metadata")
    void writesEntry() {
        UUID userId = UUID.randomUUID();

        auditService.log(userId, 42L, AuditService.INTEGRATION_CONNECTED, "Integration", "7",
                Map.of("provider", "jira"));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog entry = captor.getValue();
        assertEquals(userId, entry.getUserId());
        assertEquals(42L, entry.getTenantId());
        assertEquals("INTEGRATION_CONNECTED", entry.getAction());
        assertEquals("Integration", entry.getEntityType());
        assertEquals("7", entry.getEntityId());
        assertEquals("{\"provider\":\"jira\"}", entry.getMetadata());
    }

    @Test
    @DisplayName("A failing audit write never reaches the caller")
    void swallowsDatabaseFailure() {
        when(auditLogRepository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> auditService.log(null, null, AuditService.LOGIN, "User", "x", null));
    }
}
