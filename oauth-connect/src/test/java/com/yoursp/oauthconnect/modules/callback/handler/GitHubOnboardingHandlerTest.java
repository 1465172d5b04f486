package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.Tenant;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.ProviderClient;
import com.yoursp.oauthconnect.modules.provider.ProviderException;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.modules.selection.PendingSelection;
import com.yoursp.oauthconnect.modules.selection.PendingSelectionStore;
import com.yoursp.oauthconnect.modules.sideeffect.SideEffectDispatcher;
import com.yoursp.oauthconnect.modules.sideeffect.TaskQueue;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.modules.tenant.ProvisionedTenant;
import com.yoursp.oauthconnect.modules.tenant.TenantProvisioningService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.service.AuditService;
import com.yoursp.oauthconnect.service.TokenCipher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitHubOnboardingHandlerTest {

    private static final String REDIRECT_URI = "http://localhost:8080/auth/github/callback";
    private static final ProviderResource ACME = new ProviderResource("1", "Acme", "https://github.com/acme");
    private static final ProviderResource GLOBEX = new ProviderResource("2", "Globex", "https://github.com/globex");

    @Mock
    private ProviderClient client;
    @Mock
    private IntegrationConnector connector;
    @Mock
    private PendingSelectionStore pendingSelectionStore;
    @Mock
    private MembershipRepository membershipRepository;

    private final TokenCipher tokenCipher = new TokenCipher("handler-test-encryption-key");
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private GitHubOnboardingHandler handler;
    private User caller;

    @BeforeEach
    void setUp() {
        handler = new GitHubOnboardingHandler(client, connector, pendingSelectionStore, membershipRepository,
                tokenCipher, clock);
        caller = User.builder().id(UUID.randomUUID()).username("octocat").build();
    }

    private CallbackContext context() {
        return new CallbackContext(FlowKind.ONBOARDING, "code-1", null, caller, "session-1", REDIRECT_URI,
                new CallbackContext.ClientInfo("10.0.0.1", "JUnit"));
    }

    private void orgs(ProviderResource... resources) {
        when(client.exchangeCodeForToken("code-1", REDIRECT_URI)).thenReturn(ProviderToken.of("gho_token"));
        when(client.listResources("gho_token")).thenReturn(List.of(resources));
    }

    private static ProvisionedTenant provisioned(String name) {
        return new ProvisionedTenant(Tenant.builder().id(10L).name(name).slug("acme").build(), 20L, 30L);
    }

    @Test
    @DisplayName("No organizations: error, nothing created")
    void noOrganizations() {
        orgs();

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/start", result.redirectTo());
        assertTrue(result.messages().get(0).text().startsWith("No GitHub organizations found."));
        verifyNoInteractions(connector, pendingSelectionStore);
    }

    @Test
    @DisplayName("One organization: tenant created, continue to repositories")
    void singleOrganization() {
        orgs(ACME);
        when(connector.provisionTenant(eq(caller.getId()), eq(Provider.GITHUB), eq(ACME), any()))
                .thenReturn(provisioned("Acme"));

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/repositories", result.redirectTo());
        assertEquals("Team 'Acme' created successfully!", result.messages().get(0).text());
        verifyNoInteractions(pendingSelectionStore);
    }

    @Test
    @DisplayName("Several organizations: stash them with the encrypted token, go to selection")
    void severalOrganizations() {
        orgs(ACME, GLOBEX);

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/github/select", result.redirectTo());
        assertTrue(result.messages().isEmpty());
        verify(connector, never()).provisionTenant(any(), any(), any(), any());

        ArgumentCaptor<PendingSelection> captor = ArgumentCaptor.forClass(PendingSelection.class);
        verify(pendingSelectionStore).save(eq("session-1"), captor.capture());
        PendingSelection selection = captor.getValue();
        assertEquals(FlowKind.ONBOARDING, selection.flowKind());
        assertNull(selection.tenantId());
        assertEquals(List.of(ACME, GLOBEX), selection.candidates());
        assertNotEquals("gho_token", selection.encryptedAccessToken());
        assertEquals("gho_token", tokenCipher.decrypt(selection.encryptedAccessToken()));
    }

    @Test
    @DisplayName("Caller who already has a team goes straight to the dashboard")
    void existingMemberIsNoOp() {
        when(membershipRepository.existsByUserId(caller.getId())).thenReturn(true);

        CallbackResult result = handler.handle(context());

        assertEquals("/", result.redirectTo());
        verifyNoInteractions(client, connector);
    }

    @Test
    @DisplayName("Token exchange failure: error, nothing written")
    void exchangeFailure() {
        when(client.exchangeCodeForToken(anyString(), anyString()))
                .thenThrow(new ProviderException(Provider.GITHUB, "bad_verification_code"));

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/start", result.redirectTo());
        assertEquals("Failed to connect to GitHub. Please try again.", result.messages().get(0).text());
        verifyNoInteractions(connector, pendingSelectionStore);
    }

    @Test
    @DisplayName("Database failure while creating the team is reported, not thrown")
    void provisioningFailure() {
        orgs(ACME);
        when(connector.provisionTenant(any(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("duplicate slug"));

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/start", result.redirectTo());
        assertEquals("Failed to create team. Please try again.", result.messages().get(0).text());
    }

    @Test
    @DisplayName("Completing the selection provisions the chosen org with the stashed token")
    void completeSelection() {
        PendingSelection selection = new PendingSelection(Provider.GITHUB, FlowKind.ONBOARDING, null,
                tokenCipher.encrypt("gho_token"), List.of(ACME, GLOBEX), clock.instant());
        when(connector.provisionTenant(eq(caller.getId()), eq(Provider.GITHUB), eq(GLOBEX), any()))
                .thenReturn(provisioned("Globex"));

        CallbackResult result = handler.completeSelection(caller, selection, GLOBEX);

        assertEquals("/onboarding/repositories", result.redirectTo());
        ArgumentCaptor<ProviderToken> token = ArgumentCaptor.forClass(ProviderToken.class);
        verify(connector).provisionTenant(eq(caller.getId()), eq(Provider.GITHUB), eq(GLOBEX), token.capture());
        assertEquals("gho_token", token.getValue().accessToken());
    }

    @Test
    @DisplayName("Queue outage: tenant still created, member sync attempted, success redirect")
    void queueOutageDoesNotFailOnboarding() {
        TenantProvisioningService provisioningService = mock(TenantProvisioningService.class);
        AuditService auditService = mock(AuditService.class);
        TaskQueue brokenQueue = mock(TaskQueue.class);
        when(brokenQueue.push(any(), anyMap())).thenThrow(new RedisConnectionFailureException("redis down"));
        IntegrationConnector realConnector = new IntegrationConnector(mock(IntegrationService.class),
                provisioningService, new SideEffectDispatcher(brokenQueue), auditService);
        handler = new GitHubOnboardingHandler(client, realConnector, pendingSelectionStore, membershipRepository,
                tokenCipher, clock);

        orgs(ACME);
        when(provisioningService.provision(eq(caller.getId()), eq(Provider.GITHUB), eq(ACME), any()))
                .thenReturn(provisioned("Acme"));

        CallbackResult result = handler.handle(context());

        assertEquals("/onboarding/repositories", result.redirectTo());
        assertFalse(result.isError());
        verify(provisioningService).provision(eq(caller.getId()), eq(Provider.GITHUB), eq(ACME), any());
        verify(brokenQueue).push(any(), anyMap());
        verify(auditService).log(eq(caller.getId()), eq(10L), eq(AuditService.TENANT_CREATED), eq("Tenant"),
                eq("10"), anyMap());
    }
}
