package com.yoursp.oauthconnect.modules.state.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an OAuth state parameter is missing, tampered with, malformed,
 * outside its validity window, or violates its flow's tenant requirement.
 */
@Getter
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class InvalidStateException extends RuntimeException {

    private final StateErrorReason reason;

    public InvalidStateException(StateErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidStateException(StateErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
