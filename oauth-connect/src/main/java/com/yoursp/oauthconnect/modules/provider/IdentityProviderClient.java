package com.yoursp.oauthconnect.modules.provider;

import com.yoursp.oauthconnect.modules.provider.dto.ExternalIdentity;

import java.util.Optional;

/**
 * A provider that can also authenticate the caller.
 */
public interface IdentityProviderClient extends ProviderClient {

    ExternalIdentity getIdentity(String accessToken);

    /** The caller's primary verified email, used when the profile hides it. */
    Optional<String> getVerifiedEmail(String accessToken);
}
