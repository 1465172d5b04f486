package com.yoursp.oauthconnect.modules.tenant;

import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.repository.IntegrationCredentialRepository;
import com.yoursp.oauthconnect.repository.IntegrationRepository;
import com.yoursp.oauthconnect.service.TokenCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Writes credential and integration rows for an existing tenant.
 * Both writes are database-side upserts on {@code (tenant_id, provider)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrationService {

    private final IntegrationCredentialRepository credentialRepository;
    private final IntegrationRepository integrationRepository;
    private final TokenCipher tokenCipher;
    private final Clock clock;

    /**
     * Encrypt and store the token for a tenant, replacing any previous one.
     *
     * @return credential id
     */
    @Transactional
    public Long upsertCredential(Long tenantId, Provider provider, ProviderToken token, UUID connectedBy) {
        return storeCredential(tenantId, provider, token, connectedBy, null);
    }

    /**
     * Store a GitHub App installation token as the tenant's GitHub credential.
     * The installation id is kept so the token can be re-minted when it expires.
     *
     * @return credential id
     */
    @Transactional
    public Long upsertInstallationCredential(Long tenantId, ProviderToken token, long installationId,
            UUID connectedBy) {
        return storeCredential(tenantId, Provider.GITHUB, token, connectedBy, installationId);
    }

    private Long storeCredential(Long tenantId, Provider provider, ProviderToken token, UUID connectedBy,
            Long installationId) {
        OffsetDateTime expiresAt = token.expiresIn() != null
                ? OffsetDateTime.now(clock).plusSeconds(token.expiresIn())
                : null;

        Long credentialId = credentialRepository.upsert(
                tenantId,
                provider.name(),
                tokenCipher.encrypt(token.accessToken()),
                tokenCipher.encrypt(token.refreshToken()),
                expiresAt,
                connectedBy,
                installationId);

        log.info("Stored {} credential {} for tenant {}", provider, credentialId, tenantId);
        return credentialId;
    }

    /**
     * Point the tenant's integration for this provider at a resource.
     *
     * @return integration id
     */
    @Transactional
    public Long upsertIntegration(Long tenantId, Provider provider, Long credentialId, ProviderResource resource) {
        Long integrationId = integrationRepository.upsert(
                tenantId,
                provider.name(),
                credentialId,
                resource.id(),
                resource.name(),
                resource.url());

        log.info("Connected tenant {} to {} resource {} (integration={})",
                tenantId, provider, resource.id(), integrationId);
        return integrationId;
    }

    /** Credential id stored earlier for this tenant, e.g. before a selection step. */
    @Transactional(readOnly = true)
    public Long requireCredentialId(Long tenantId, Provider provider) {
        return credentialRepository.findByTenantIdAndProvider(tenantId, provider)
                .orElseThrow(() -> new IllegalStateException(
                        "No " + provider + " credential for tenant " + tenantId))
                .getId();
    }
}
