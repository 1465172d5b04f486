package com.yoursp.oauthconnect.modules.tenant;

import com.yoursp.oauthconnect.model.entity.Membership;
import com.yoursp.oauthconnect.model.entity.Tenant;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates a tenant from a provider resource during onboarding:
 * tenant with a unique slug, the caller as administrator, the encrypted
 * credential and the integration record, all in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantProvisioningService {

    private final TenantRepository tenantRepository;
    private final MembershipRepository membershipRepository;
    private final IntegrationService integrationService;

    @Transactional
    public ProvisionedTenant provision(UUID userId, Provider provider, ProviderResource resource, ProviderToken token) {
        Tenant tenant = tenantRepository.save(Tenant.builder()
                .name(resource.name())
                .slug(nextUniqueSlug(resource.name()))
                .build());

        membershipRepository.save(Membership.builder()
                .tenantId(tenant.getId())
                .userId(userId)
                .role(Membership.ROLE_ADMIN)
                .build());

        Long credentialId = integrationService.upsertCredential(tenant.getId(), provider, token, userId);
        Long integrationId = integrationService.upsertIntegration(tenant.getId(), provider, credentialId, resource);

        log.info("Provisioned tenant {} ({}) from {} resource {}", tenant.getId(), tenant.getSlug(), provider,
                resource.id());
        return new ProvisionedTenant(tenant, credentialId, integrationId);
    }

    /** {@code acme}, then {@code acme-2}, {@code acme-3}, ... */
    String nextUniqueSlug(String name) {
        String base = TenantSlugs.slugify(name);
        String candidate = base;
        int suffix = 2;
        while (tenantRepository.existsBySlug(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
