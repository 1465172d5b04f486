package com.yoursp.oauthconnect.modules.callback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.dto.FlashMessage;
import com.yoursp.oauthconnect.modules.callback.dto.ProviderCallbackRequest;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandler;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandlerRegistry;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.state.StateTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OAuthCallbackDispatcherTest {

    private static final String REDIRECT_URI = "http://localhost:8080/auth/github/callback";
    private static final CallbackContext.ClientInfo CLIENT = new CallbackContext.ClientInfo("10.0.0.1", "JUnit");

    @Mock
    private FlowHandler handler;

    private final FlowRegistry flowRegistry = new FlowRegistry();
    private StateTokenCodec codec;
    private FlowHandlerRegistry handlers;
    private User caller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        codec = new StateTokenCodec(new ObjectMapper(), flowRegistry, clock, "dispatcher-test-secret");

        Map<FlowKind, FlowHandler> map = new EnumMap<>(FlowKind.class);
        for (FlowKind kind : FlowKind.values()) {
            map.put(kind, handler);
        }
        handlers = new FlowHandlerRegistry(map);
        caller = User.builder().id(UUID.randomUUID()).username("octocat").build();
    }

    private OAuthCallbackDispatcher dispatcher(Provider provider) {
        return new OAuthCallbackDispatcher(provider, codec, flowRegistry, handlers);
    }

    private CallbackResult dispatch(Provider provider, ProviderCallbackRequest request, User user) {
        return dispatcher(provider).dispatch(request, user, user != null ? "session-1" : null, REDIRECT_URI, CLIENT);
    }

    private static String onlyMessage(CallbackResult result) {
        assertEquals(1, result.messages().size());
        return result.messages().get(0).text();
    }

    @Test
    @DisplayName("access_denied on an integration flow reports the description and returns to /integrations")
    void providerErrorUsesFlowRedirect() {
        String state = codec.encode(FlowKind.INTEGRATION, 42L);

        CallbackResult result = dispatch(Provider.GITHUB,
                new ProviderCallbackRequest(state, null, "access_denied", "User denied"), caller);

        assertEquals("/integrations", result.redirectTo());
        assertTrue(onlyMessage(result).contains("User denied"));
        assertEquals("GitHub authorization failed: User denied", onlyMessage(result));
        assertTrue(result.isError());
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Provider error without a description says 'Unknown error'")
    void providerErrorWithoutDescription() {
        String state = codec.encode(FlowKind.SLACK_ONBOARDING, null);

        CallbackResult result = dispatch(Provider.SLACK,
                new ProviderCallbackRequest(state, null, "access_denied", null), caller);

        assertEquals("/onboarding/slack", result.redirectTo());
        assertEquals("Slack authorization failed: Unknown error", onlyMessage(result));
    }

    @Test
    @DisplayName("Invalid state redirects to / with a generic message, even when the provider sent an error")
    void invalidStateWinsOverEverything() {
        CallbackResult result = dispatch(Provider.GITHUB,
                new ProviderCallbackRequest("garbage.token", "code", "access_denied", "User denied"), caller);

        assertEquals("/", result.redirectTo());
        assertEquals("Invalid OAuth state. Please try again.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Missing state is an invalid state")
    void missingState() {
        CallbackResult result = dispatch(Provider.JIRA, new ProviderCallbackRequest(null, "code", null, null), caller);

        assertEquals("/", result.redirectTo());
        assertEquals("Invalid OAuth state. Please try again.", onlyMessage(result));
    }

    @Test
    @DisplayName("Missing code redirects to the flow's failure path")
    void missingCode() {
        String state = codec.encode(FlowKind.LOGIN, null);

        CallbackResult result = dispatch(Provider.GITHUB, new ProviderCallbackRequest(state, " ", null, null), null);

        assertEquals("/accounts/login", result.redirectTo());
        assertEquals("No authorization code received from GitHub.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("A Jira state on the GitHub callback is an invalid flow")
    void crossProviderStateIsRejected() {
        String state = codec.encode(FlowKind.JIRA_INTEGRATION, 42L);

        CallbackResult result = dispatch(Provider.GITHUB, new ProviderCallbackRequest(state, "code", null, null), caller);

        assertEquals("/", result.redirectTo());
        assertEquals("Invalid OAuth flow. Please try again.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Flows other than login need a signed-in caller")
    void nonLoginFlowRequiresCaller() {
        String state = codec.encode(FlowKind.JIRA_ONBOARDING, null);

        CallbackResult result = dispatch(Provider.JIRA, new ProviderCallbackRequest(state, "code", null, null), null);

        assertEquals("/accounts/login", result.redirectTo());
        assertEquals("Please log in first.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Login is dispatched without a caller")
    void loginNeedsNoCaller() {
        when(handler.handle(any())).thenReturn(CallbackResult.redirect("/onboarding/start").withSession("tok"));
        String state = codec.encode(FlowKind.LOGIN, null);

        CallbackResult result = dispatch(Provider.GITHUB, new ProviderCallbackRequest(state, "abc", null, null), null);

        assertEquals("/onboarding/start", result.redirectTo());
        assertEquals("tok", result.sessionToken());
    }

    @Test
    @DisplayName("A valid callback reaches the handler with code, tenant and caller")
    void routesToHandler() {
        CallbackResult expected = CallbackResult.success("/integrations", "Connected to acme.");
        when(handler.handle(any())).thenReturn(expected);
        String state = codec.encode(FlowKind.SLACK_INTEGRATION, 42L);

        CallbackResult result = dispatch(Provider.SLACK, new ProviderCallbackRequest(state, "xyz", null, null), caller);

        assertSame(expected, result);
        ArgumentCaptor<CallbackContext> captor = ArgumentCaptor.forClass(CallbackContext.class);
        verify(handler).handle(captor.capture());
        CallbackContext context = captor.getValue();
        assertEquals(FlowKind.SLACK_INTEGRATION, context.flowKind());
        assertEquals("xyz", context.code());
        assertEquals(42L, context.tenantId());
        assertSame(caller, context.caller());
        assertEquals("session-1", context.sessionHandle());
        assertEquals(REDIRECT_URI, context.redirectUri());
        assertEquals(CLIENT, context.client());
    }

    @Test
    @DisplayName("GitHub App install is granted by installation_id, without a code")
    void appInstallRoutesInstallationId() {
        when(handler.handle(any())).thenReturn(CallbackResult.success("/integrations", "GitHub App installed for acme."));
        String state = codec.encode(FlowKind.GITHUB_APP_INSTALL, 42L);

        dispatch(Provider.GITHUB, new ProviderCallbackRequest(state, null, null, null, "4242", "install"), caller);

        ArgumentCaptor<CallbackContext> captor = ArgumentCaptor.forClass(CallbackContext.class);
        verify(handler).handle(captor.capture());
        assertEquals(FlowKind.GITHUB_APP_INSTALL, captor.getValue().flowKind());
        assertEquals("4242", captor.getValue().installationId());
        assertEquals("install", captor.getValue().setupAction());
        assertEquals(42L, captor.getValue().tenantId());
    }

    @Test
    @DisplayName("GitHub App install pending owner approval still reaches the handler")
    void appInstallRequestReachesHandler() {
        when(handler.handle(any())).thenReturn(CallbackResult.info("/integrations", "requested"));
        String state = codec.encode(FlowKind.GITHUB_APP_INSTALL, 42L);

        CallbackResult result = dispatch(Provider.GITHUB,
                new ProviderCallbackRequest(state, null, null, null, null, "request"), caller);

        assertEquals(FlashMessage.Level.INFO, result.messages().get(0).level());
        verify(handler).handle(any());
    }

    @Test
    @DisplayName("GitHub App install without installation_id fails even when a code is present")
    void appInstallWithoutInstallation() {
        String state = codec.encode(FlowKind.GITHUB_APP_INSTALL, 42L);

        CallbackResult result = dispatch(Provider.GITHUB,
                new ProviderCallbackRequest(state, "code-1", null, null), caller);

        assertEquals("/integrations", result.redirectTo());
        assertEquals("No installation received from GitHub.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("An installation_id does not stand in for the code on OAuth flows")
    void installationIdIsNotACode() {
        String state = codec.encode(FlowKind.INTEGRATION, 42L);

        CallbackResult result = dispatch(Provider.GITHUB,
                new ProviderCallbackRequest(state, null, null, null, "4242", "install"), caller);

        assertEquals("No authorization code received from GitHub.", onlyMessage(result));
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("An unexpected handler exception becomes the flow's failure redirect")
    void handlerExceptionIsContained() {
        when(handler.handle(any())).thenThrow(new IllegalStateException("boom"));
        String state = codec.encode(FlowKind.ONBOARDING, null);

        CallbackResult result = dispatch(Provider.GITHUB, new ProviderCallbackRequest(state, "abc", null, null), caller);

        assertEquals("/onboarding/start", result.redirectTo());
        assertEquals(FlashMessage.Level.ERROR, result.messages().get(0).level());
    }

    @Test
    @DisplayName("Registry refuses to start with a flow kind unhandled")
    void registryRequiresEveryKind() {
        Map<FlowKind, FlowHandler> partial = new EnumMap<>(FlowKind.class);
        partial.put(FlowKind.LOGIN, handler);

        assertThrows(IllegalStateException.class, () -> new FlowHandlerRegistry(partial));
    }
}
