package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.IntegrationCredential;
import com.yoursp.oauthconnect.modules.provider.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IntegrationCredentialRepository extends JpaRepository<IntegrationCredential, Long> {

    Optional<IntegrationCredential> findByTenantIdAndProvider(Long tenantId, Provider provider);

    /**
     * Atomic insert-or-update on {@code (tenant_id, provider)}.
     * Concurrent callers converge on a single row.
     *
     * @return id of the inserted or updated row
     */
    @Query(value = "INSERT INTO integration_credentials "
            + "(tenant_id, provider, access_token, refresh_token, token_expires_at, connected_by, installation_id, "
            + "created_at, updated_at) "
            + "VALUES (:tenantId, :provider, :accessToken, :refreshToken, :expiresAt, :connectedBy, :installationId, "
            + "now(), now()) "
            + "ON CONFLICT (tenant_id, provider) DO UPDATE SET "
            + "access_token = EXCLUDED.access_token, "
            + "refresh_token = EXCLUDED.refresh_token, "
            + "token_expires_at = EXCLUDED.token_expires_at, "
            + "connected_by = EXCLUDED.connected_by, "
            + "installation_id = EXCLUDED.installation_id, "
            + "updated_at = now() "
            + "RETURNING id", nativeQuery = true)
    Long upsert(Long tenantId, String provider, String accessToken, String refreshToken,
            OffsetDateTime expiresAt, UUID connectedBy, Long installationId);
}
