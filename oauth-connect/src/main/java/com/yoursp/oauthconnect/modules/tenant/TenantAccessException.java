package com.yoursp.oauthconnect.modules.tenant;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the caller is not allowed to act on a tenant.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class TenantAccessException extends RuntimeException {

    public TenantAccessException(String message) {
        super(message);
    }
}
