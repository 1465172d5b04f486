package com.yoursp.oauthconnect.modules.callback;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.dto.ProviderCallbackRequest;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandler;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandlerRegistry;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.state.StateTokenCodec;
import com.yoursp.oauthconnect.modules.state.dto.StatePayload;
import com.yoursp.oauthconnect.modules.state.exception.InvalidStateException;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates one provider's OAuth callback and routes it to a flow handler.
 * <ol>
 * <li>Decode the state; failure → generic message, fallback redirect (the flow is unknown)</li>
 * <li>Provider reported {@code error} → message with its description, flow redirect</li>
 * <li>No {@code code} (no {@code installation_id} for the GitHub App install) → message, flow redirect</li>
 * <li>State issued for another provider → generic message, fallback redirect</li>
 * <li>Flows other than login require an authenticated caller → login redirect</li>
 * <li>Hand {@code code} and tenant id to the flow's handler</li>
 * </ol>
 * Every outcome is a {@link CallbackResult}; nothing is thrown to the caller.
 * A state token is not single-use: it can be replayed until it expires, and
 * handlers rely on upserts to stay idempotent.
 */
@Slf4j
public class OAuthCallbackDispatcher {

    static final String INVALID_STATE_MESSAGE = "Invalid OAuth state. Please try again.";
    static final String INVALID_FLOW_MESSAGE = "Invalid OAuth flow. Please try again.";
    static final String LOGIN_REQUIRED_MESSAGE = "Please log in first.";
    static final String UNEXPECTED_ERROR_MESSAGE = "Something went wrong. Please try again.";

    private final Provider provider;
    private final StateTokenCodec stateTokenCodec;
    private final FlowRegistry flowRegistry;
    private final FlowHandlerRegistry handlers;

    public OAuthCallbackDispatcher(Provider provider,
            StateTokenCodec stateTokenCodec,
            FlowRegistry flowRegistry,
            FlowHandlerRegistry handlers) {
        this.provider = provider;
        this.stateTokenCodec = stateTokenCodec;
        this.flowRegistry = flowRegistry;
        this.handlers = handlers;
    }

    public Provider provider() {
        return provider;
    }

    /**
     * @param request       callback query parameters
     * @param caller        authenticated user, or {@code null}
     * @param sessionHandle caller's session handle, or {@code null}
     * @param redirectUri   this provider's callback URI
     * @param client        request origin
     */
    public CallbackResult dispatch(ProviderCallbackRequest request,
            User caller,
            String sessionHandle,
            String redirectUri,
            CallbackContext.ClientInfo client) {

        // 1. State
        StatePayload state;
        try {
            state = stateTokenCodec.decode(request.state());
        } catch (InvalidStateException e) {
            log.warn("Invalid {} OAuth state ({}): {}", provider.slug(), e.getReason(), e.getMessage());
            return CallbackResult.error(flowRegistry.failureRedirect(null), INVALID_STATE_MESSAGE);
        }
        FlowKind kind = state.flowKind();

        // 2. Provider-reported error
        if (request.hasError()) {
            String description = request.errorDescription() != null ? request.errorDescription() : "Unknown error";
            log.warn("{} authorization failed for flow {}: {} ({})",
                    provider.displayName(), kind.wireValue(), request.error(), description);
            return CallbackResult.error(flowRegistry.failureRedirect(kind),
                    provider.displayName() + " authorization failed: " + description);
        }

        // 3. Grant
        if (kind.grantsInstallation()) {
            if (!request.hasInstallation()) {
                return CallbackResult.error(flowRegistry.failureRedirect(kind),
                        "No installation received from " + provider.displayName() + ".");
            }
        } else if (!request.hasCode()) {
            return CallbackResult.error(flowRegistry.failureRedirect(kind),
                    "No authorization code received from " + provider.displayName() + ".");
        }

        // 4. Route
        if (kind.provider() != provider) {
            log.error("Flow {} arrived on the {} callback", kind.wireValue(), provider.slug());
            return CallbackResult.error(flowRegistry.failureRedirect(null), INVALID_FLOW_MESSAGE);
        }

        if (kind != FlowKind.LOGIN && caller == null) {
            return CallbackResult.error(FlowRegistry.LOGIN_PATH, LOGIN_REQUIRED_MESSAGE);
        }

        FlowHandler handler = handlers.find(kind).orElse(null);
        if (handler == null) {
            log.error("No handler for flow {}", kind.wireValue());
            return CallbackResult.error(flowRegistry.failureRedirect(null), INVALID_FLOW_MESSAGE);
        }

        CallbackContext context = new CallbackContext(
                kind, request.code(), state.tenantId(), caller, sessionHandle, redirectUri, client,
                request.installationId(), request.setupAction());
        try {
            CallbackResult result = handler.handle(context);
            log.info("{} callback for flow {} finished, redirecting to {}",
                    provider.displayName(), kind.wireValue(), result.redirectTo());
            return result;
        } catch (RuntimeException e) {
            log.error("{} callback for flow {} failed unexpectedly: {}",
                    provider.displayName(), kind.wireValue(), e.getMessage(), e);
            return CallbackResult.error(flowRegistry.failureRedirect(kind), UNEXPECTED_ERROR_MESSAGE);
        }
    }
}
