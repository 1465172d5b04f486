package com.yoursp.oauthconnect.modules.state.dto;

import com.yoursp.oauthconnect.modules.state.FlowKind;

/**
 * Decoded contents of an OAuth state token.
 *
 * @param flowKind why the flow was started
 * @param issuedAt epoch seconds at issuance ({@code iat})
 * @param tenantId tenant the flow targets, or {@code null} ({@code team_id})
 */
public record StatePayload(
        FlowKind flowKind,
        long issuedAt,
        Long tenantId) {

    public boolean hasTenant() {
        return tenantId != null;
    }
}
