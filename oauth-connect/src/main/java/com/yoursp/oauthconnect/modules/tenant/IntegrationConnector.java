package com.yoursp.oauthconnect.modules.tenant;

import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.modules.sideeffect.SideEffectDispatcher;
import com.yoursp.oauthconnect.modules.sideeffect.TaskKind;
import com.yoursp.oauthconnect.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Finishes a connection in a fixed order: durable write (committed on
 * return), then the best-effort member sync enqueue, then the audit entry.
 * Nothing after the write can undo it.
 */
@Component
@RequiredArgsConstructor
public class IntegrationConnector {

    private final IntegrationService integrationService;
    private final TenantProvisioningService provisioningService;
    private final SideEffectDispatcher sideEffectDispatcher;
    private final AuditService auditService;

    /**
     * Attach a resource to an existing tenant.
     *
     * @param flow flow name recorded in the audit entry
     * @return integration id
     */
    public Long connect(Long tenantId, Provider provider, Long credentialId, ProviderResource resource,
            UUID userId, String flow) {
        Long integrationId = integrationService.upsertIntegration(tenantId, provider, credentialId, resource);

        queueMemberSync(provider, tenantId, integrationId);
        auditService.log(userId, tenantId, AuditService.INTEGRATION_CONNECTED, "Integration",
                String.valueOf(integrationId),
                Map.of("provider", provider.slug(), "resource", resource.name(), "flow", flow));
        return integrationId;
    }

    /**
     * Create a tenant named after the resource, with the caller as administrator.
     */
    public ProvisionedTenant provisionTenant(UUID userId, Provider provider, ProviderResource resource,
            ProviderToken token) {
        ProvisionedTenant provisioned = provisioningService.provision(userId, provider, resource, token);
        Long tenantId = provisioned.tenant().getId();

        queueMemberSync(provider, tenantId, provisioned.integrationId());
        auditService.log(userId, tenantId, AuditService.TENANT_CREATED, "Tenant", String.valueOf(tenantId),
                Map.of("provider", provider.slug(), "resource", resource.name(),
                        "slug", provisioned.tenant().getSlug()));
        return provisioned;
    }

    private void queueMemberSync(Provider provider, Long tenantId, Long integrationId) {
        sideEffectDispatcher.enqueue(TaskKind.memberSyncFor(provider),
                Map.of("tenant_id", tenantId, "integration_id", integrationId));
    }
}
