package com.yoursp.oauthconnect.modules.state;

/**
 * Whether a flow kind's state token must, must not, or may carry a tenant id.
 */
public enum TenantRequirement {
    REQUIRED,
    FORBIDDEN,
    OPTIONAL
}
