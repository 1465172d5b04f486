package com.yoursp.oauthconnect.modules.auth;

import com.yoursp.oauthconnect.model.entity.User;

/**
 * Local user behind a provider login, and how it was found.
 */
public record ResolvedAccount(User user, Resolution resolution) {

    public enum Resolution {
        /** An existing link matched the external id. */
        LINKED,
        /** An existing user matched by email and was linked. */
        MATCHED_BY_EMAIL,
        /** A new user was created. */
        CREATED
    }
}
