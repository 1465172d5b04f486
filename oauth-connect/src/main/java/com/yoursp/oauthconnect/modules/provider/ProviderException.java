package com.yoursp.oauthconnect.modules.provider;

import lombok.Getter;

/**
 * Thrown when a provider call fails: token exchange, resource listing,
 * identity lookup, a timeout or an open circuit breaker.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final Provider provider;

    public ProviderException(Provider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(Provider provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
