package com.yoursp.oauthconnect.modules.callback.dto;

/**
 * Query parameters of {@code GET /auth/{provider}/callback}.
 * Either {@code code} or {@code error} is expected, never both. GitHub App
 * installs report {@code installation_id} and {@code setup_action} instead.
 */
public record ProviderCallbackRequest(
        String state,
        String code,
        String error,
        String errorDescription,
        String installationId,
        String setupAction) {

    public static final String SETUP_ACTION_REQUEST = "request";

    public ProviderCallbackRequest(String state, String code, String error, String errorDescription) {
        this(state, code, error, errorDescription, null, null);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }

    /** An installation id, or a pending install awaiting an organization owner's approval. */
    public boolean hasInstallation() {
        return (installationId != null && !installationId.isBlank())
                || SETUP_ACTION_REQUEST.equals(setupAction);
    }
}
