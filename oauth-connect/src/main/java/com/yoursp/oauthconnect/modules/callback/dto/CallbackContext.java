package com.yoursp.oauthconnect.modules.callback.dto;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.state.FlowKind;

/**
 * Everything a flow handler needs once the callback has been validated.
 *
 * @param flowKind      flow from the decoded state
 * @param code          authorization code; never blank except in the GitHub App install flow
 * @param tenantId      tenant from the state, may be null
 * @param caller        authenticated user; null only for the login flow
 * @param sessionHandle caller's opaque session handle, null when unauthenticated
 * @param redirectUri   callback URI the code was issued for
 * @param client        request origin, used when a session is created
 * @param installationId GitHub App installation id, GitHub App install flow only
 * @param setupAction    GitHub App {@code setup_action}, GitHub App install flow only
 */
public record CallbackContext(
        FlowKind flowKind,
        String code,
        Long tenantId,
        User caller,
        String sessionHandle,
        String redirectUri,
        ClientInfo client,
        String installationId,
        String setupAction) {

    public CallbackContext(FlowKind flowKind, String code, Long tenantId, User caller,
                           String sessionHandle, String redirectUri, ClientInfo client) {
        this(flowKind, code, tenantId, caller, sessionHandle, redirectUri, client, null, null);
    }

    public record ClientInfo(String ipAddress, String userAgent) {
    }
}
