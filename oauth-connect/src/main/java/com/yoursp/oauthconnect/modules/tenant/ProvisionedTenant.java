package com.yoursp.oauthconnect.modules.tenant;

import com.yoursp.oauthconnect.model.entity.Tenant;

/**
 * Result of creating a tenant from a provider resource.
 */
public record ProvisionedTenant(
        Tenant tenant,
        Long credentialId,
        Long integrationId) {
}
