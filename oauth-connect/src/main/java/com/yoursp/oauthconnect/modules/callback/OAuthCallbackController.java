package com.yoursp.oauthconnect.modules.callback;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.auth.SessionAuthFilter;
import com.yoursp.oauthconnect.modules.auth.SessionService;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.dto.FlashMessage;
import com.yoursp.oauthconnect.modules.callback.dto.ProviderCallbackRequest;
import com.yoursp.oauthconnect.modules.connect.AuthorizeUrlBuilder;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.service.FlashMessageService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single landing point for every provider redirect.
 * <p>
 * Always answers 302. The outcome travels in the flash cookie, and the
 * login flow additionally sets the session cookie.
 * </p>
 */
@Slf4j
@RestController
public class OAuthCallbackController {

    private final Map<Provider, OAuthCallbackDispatcher> dispatchers = new EnumMap<>(Provider.class);
    private final AuthorizeUrlBuilder authorizeUrlBuilder;
    private final SessionService sessionService;
    private final FlashMessageService flashMessageService;

    public OAuthCallbackController(List<OAuthCallbackDispatcher> dispatchers,
            AuthorizeUrlBuilder authorizeUrlBuilder,
            SessionService sessionService,
            FlashMessageService flashMessageService) {
        dispatchers.forEach(d -> this.dispatchers.put(d.provider(), d));
        this.authorizeUrlBuilder = authorizeUrlBuilder;
        this.sessionService = sessionService;
        this.flashMessageService = flashMessageService;
    }

    @GetMapping("/auth/{provider}/callback")
    public void callback(@PathVariable("provider") String providerSlug,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "error", required = false) String error,
            @RequestParam(value = "error_description", required = false) String errorDescription,
            @RequestParam(value = "installation_id", required = false) String installationId,
            @RequestParam(value = "setup_action", required = false) String setupAction,
            HttpServletRequest request,
            HttpServletResponse response) throws IOException {

        Optional<OAuthCallbackDispatcher> dispatcher = Provider.fromSlug(providerSlug).map(dispatchers::get);
        if (dispatcher.isEmpty()) {
            log.warn("Callback for unknown provider '{}'", providerSlug);
            flashMessageService.write(response,
                    List.of(FlashMessage.error(OAuthCallbackDispatcher.INVALID_FLOW_MESSAGE)));
            response.sendRedirect(FlowRegistry.FALLBACK_REDIRECT);
            return;
        }

        OAuthCallbackDispatcher target = dispatcher.get();
        CallbackResult result = target.dispatch(
                new ProviderCallbackRequest(state, code, error, errorDescription, installationId, setupAction),
                (User) request.getAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE),
                (String) request.getAttribute(SessionAuthFilter.SESSION_HANDLE_ATTRIBUTE),
                authorizeUrlBuilder.callbackUri(target.provider()),
                clientInfo(request));

        if (result.sessionToken() != null) {
            sessionService.writeCookie(response, result.sessionToken());
        }
        flashMessageService.write(response, result.messages());
        response.sendRedirect(result.redirectTo());
    }

    /**
     * Remote address as resolved by {@code ForwardedHeaderFilter}
     * ({@code server.forward-headers-strategy: framework}), never the raw header.
     */
    static CallbackContext.ClientInfo clientInfo(HttpServletRequest request) {
        return new CallbackContext.ClientInfo(request.getRemoteAddr(), request.getHeader("User-Agent"));
    }
}
