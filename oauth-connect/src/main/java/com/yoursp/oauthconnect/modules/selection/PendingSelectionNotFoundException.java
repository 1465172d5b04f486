package com.yoursp.oauthconnect.modules.selection;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * No pending selection for this session and provider, or it expired.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class PendingSelectionNotFoundException extends RuntimeException {

    public PendingSelectionNotFoundException(String message) {
        super(message);
    }
}
