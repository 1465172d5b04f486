package com.yoursp.oauthconnect.repository;

import com.yoursp.oauthconnect.model.entity.Integration;
import com.yoursp.oauthconnect.modules.provider.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, Long> {

    Optional<Integration> findByTenantIdAndProvider(Long tenantId, Provider provider);

    /**
     * Atomic insert-or-update on {@code (tenant_id, provider)}; the latest
     * resource listing wins.
     *
     * @return id of the inserted or updated row
     */
    @Query(value = "INSERT INTO integrations "
            + "(tenant_id, provider, credential_id, resource_id, resource_name, resource_url, created_at, updated_at) "
            + "VALUES (:tenantId, :provider, :credentialId, :resourceId, :resourceName, :resourceUrl, now(), now()) "
            + "ON CONFLICT (tenant_id, provider) DO UPDATE SET "
            + "credential_id = EXCLUDED.credential_id, "
            + "resource_id = EXCLUDED.resource_id, "
            + "resource_name = EXCLUDED.resource_name, "
            + "resource_url = EXCLUDED.resource_url, "
            + "updated_at = now() "
            + "RETURNING id", nativeQuery = true)
    Long upsert(Long tenantId, String provider, Long credentialId,
            String resourceId, String resourceName, String resourceUrl);
}
