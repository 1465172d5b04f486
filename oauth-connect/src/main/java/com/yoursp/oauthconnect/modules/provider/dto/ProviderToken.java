package com.yoursp.oauthconnect.modules.provider.dto;

/**
 * Token material returned by a provider's code exchange.
 *
 * @param accessToken  bearer token, never null
 * @param refreshToken refresh token when the provider issues one
 * @param expiresIn    lifetime in seconds, when reported
 */
public record ProviderToken(
        String accessToken,
        String refreshToken,
        Long expiresIn) {

    public static ProviderToken of(String accessToken) {
        return new ProviderToken(accessToken, null, null);
    }
}
