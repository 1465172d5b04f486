package com.yoursp.oauthconnect.modules.provider;

import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;

import java.util.List;

/**
 * Capability every OAuth provider exposes to the callback handlers.
 * Implementations throw {@link ProviderException} for any failure,
 * including timeouts and an open circuit breaker.
 */
public interface ProviderClient {

    Provider provider();

    ProviderToken exchangeCodeForToken(String code, String redirectUri);

    List<ProviderResource> listResources(String accessToken);
}
