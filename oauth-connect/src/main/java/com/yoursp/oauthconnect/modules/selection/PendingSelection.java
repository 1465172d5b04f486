package com.yoursp.oauthconnect.modules.selection;

import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.state.FlowKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Candidates stashed by a callback that found more than one resource,
 * waiting for the caller to pick one.
 *
 * @param provider             provider the candidates belong to
 * @param flowKind             flow that produced them
 * @param tenantId             tenant being connected; {@code null} when the selection creates the tenant
 * @param encryptedAccessToken token ciphertext, only when no credential row exists yet
 * @param candidates           two or more resources
 * @param createdAt            when the callback stashed them
 */
public record PendingSelection(
        Provider provider,
        FlowKind flowKind,
        Long tenantId,
        String encryptedAccessToken,
        List<ProviderResource> candidates,
        Instant createdAt) {

    public Optional<ProviderResource> candidate(String resourceId) {
        return candidates.stream()
                .filter(c -> c.id().equals(resourceId))
                .findFirst();
    }
}
