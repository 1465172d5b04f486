package com.yoursp.oauthconnect.modules.state.exception;

public enum StateErrorReason {
    MISSING,
    BAD_SIGNATURE,
    MALFORMED,
    UNKNOWN_FLOW,
    MISSING_TIMESTAMP,
    EXPIRED,
    FUTURE,
    MISSING_TENANT
}
