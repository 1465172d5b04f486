package com.yoursp.oauthconnect.modules.provider.dto;

/**
 * Identity of the caller as reported by a login-capable provider.
 *
 * @param id          stable provider-side user id
 * @param handle      login name
 * @param email       public email, may be null
 * @param displayName full display name, may be null
 */
public record ExternalIdentity(
        String id,
        String handle,
        String email,
        String displayName) {
}
