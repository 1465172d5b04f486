package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.Membership;
import com.yoursp.oauthconnect.model.entity.Tenant;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.dto.FlashMessage;
import com.yoursp.oauthconnect.modules.provider.GitHubAppClient;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.ProviderException;
import com.yoursp.oauthconnect.modules.provider.dto.GitHubInstallation;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.modules.sideeffect.SideEffectDispatcher;
import com.yoursp.oauthconnect.modules.sideeffect.TaskKind;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.modules.tenant.TenantProvisioningService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.repository.TenantRepository;
import com.yoursp.oauthconnect.service.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GitHubAppInstallHandlerTest {

    private static final long TENANT_ID = 42L;
    private static final String REDIRECT_URI = "http://localhost:8080/auth/github/callback";
    private static final GitHubInstallation INSTALLATION = new GitHubInstallation(4242L,
            new ProviderResource("9001", "acme", "https://github.com/acme"), "Organization");

    @Mock
    private GitHubAppClient appClient;
    @Mock
    private TenantRepository tenantRepository;
    @Mock
    private MembershipRepository membershipRepository;
    @Mock
    private IntegrationService integrationService;
    @Mock
    private SideEffectDispatcher sideEffectDispatcher;
    @Mock
    private AuditService auditService;

    private GitHubAppInstallHandler handler;
    private User caller;

    @BeforeEach
    void setUp() {
        IntegrationConnector connector = new IntegrationConnector(integrationService,
                mock(TenantProvisioningService.class), sideEffectDispatcher, auditService);
        handler = new GitHubAppInstallHandler(appClient, tenantRepository, membershipRepository,
                integrationService, connector);
        caller = User.builder().id(UUID.randomUUID()).username("alice").build();

        when(tenantRepository.findById(TENANT_ID))
                .thenReturn(Optional.of(Tenant.builder().id(TENANT_ID).name("Acme").slug("acme").build()));
        when(membershipRepository.findByTenantIdAndUserId(TENANT_ID, caller.getId())).thenReturn(Optional.of(
                Membership.builder().tenantId(TENANT_ID).userId(caller.getId()).role(Membership.ROLE_ADMIN).build()));
        when(integrationService.upsertInstallationCredential(anyLong(), any(), anyLong(), any())).thenReturn(7L);
        when(integrationService.upsertIntegration(anyLong(), any(), anyLong(), any())).thenReturn(11L);
    }

    private CallbackContext context(String installationId, String setupAction) {
        return new CallbackContext(FlowKind.GITHUB_APP_INSTALL, null, TENANT_ID, caller, "session-1",
                REDIRECT_URI, new CallbackContext.ClientInfo("10.0.0.1", "JUnit"), installationId, setupAction);
    }

    @Test
    @DisplayName("A verified installation stores its token and connects the installed account")
    void connectsInstallation() {
        ProviderToken token = new ProviderToken("ghs_abc", null, 3600L);
        when(appClient.getInstallation(4242L)).thenReturn(INSTALLATION);
        when(appClient.createInstallationToken(4242L)).thenReturn(token);

        CallbackResult result = handler.handle(context("4242", "install"));

        assertEquals("/integrations", result.redirectTo());
        assertEquals("GitHub App installed for acme.", result.messages().get(0).text());
        assertFalse(result.isError());
        verify(integrationService).upsertInstallationCredential(TENANT_ID, token, 4242L, caller.getId());
        verify(integrationService).upsertIntegration(TENANT_ID, Provider.GITHUB, 7L, INSTALLATION.account());
        verify(sideEffectDispatcher).enqueue(eq(TaskKind.GITHUB_MEMBER_SYNC), anyMap());
        verify(auditService).log(eq(caller.getId()), eq(TENANT_ID), eq(AuditService.INTEGRATION_CONNECTED),
                eq("Integration"), eq("11"), argThat(details -> "github_app_team".equals(details.get("flow"))));
    }

    @Test
    @DisplayName("An install awaiting owner approval is reported as pending, nothing stored")
    void pendingApproval() {
        CallbackResult result = handler.handle(context(null, "request"));

        assertEquals("/integrations", result.redirectTo());
        assertEquals(FlashMessage.Level.INFO, result.messages().get(0).level());
        assertEquals(GitHubAppInstallHandler.REQUESTED_MESSAGE, result.messages().get(0).text());
        assertFalse(result.isError());
        verifyNoInteractions(appClient);
        verify(integrationService, never()).upsertInstallationCredential(anyLong(), any(), anyLong(), any());
    }

    @Test
    @DisplayName("A non-numeric installation id is rejected before calling GitHub")
    void malformedInstallationId() {
        CallbackResult result = handler.handle(context("42abc", "install"));

        assertEquals("/integrations", result.redirectTo());
        assertEquals("Invalid GitHub App installation.", result.messages().get(0).text());
        verifyNoInteractions(appClient);
    }

    @Test
    @DisplayName("An installation GitHub will not confirm is an error, nothing stored")
    void unverifiedInstallation() {
        when(appClient.getInstallation(4242L))
                .thenThrow(new ProviderException(Provider.GITHUB, "GitHub App installation lookup failed: 404"));

        CallbackResult result = handler.handle(context("4242", "install"));

        assertEquals("/integrations", result.redirectTo());
        assertEquals(GitHubAppInstallHandler.VERIFY_FAILED_MESSAGE, result.messages().get(0).text());
        assertTrue(result.isError());
        verify(integrationService, never()).upsertInstallationCredential(anyLong(), any(), anyLong(), any());
        verifyNoInteractions(sideEffectDispatcher, auditService);
    }

    @Test
    @DisplayName("Members without admin rights cannot attach an installation")
    void nonAdmin() {
        when(membershipRepository.findByTenantIdAndUserId(TENANT_ID, caller.getId())).thenReturn(Optional.of(
                Membership.builder().tenantId(TENANT_ID).userId(caller.getId()).role(Membership.ROLE_MEMBER).build()));

        CallbackResult result = handler.handle(context("4242", "install"));

        assertEquals("/", result.redirectTo());
        assertEquals("You don't have access to this team.", result.messages().get(0).text());
        verifyNoInteractions(appClient);
    }

    @Test
    @DisplayName("Unknown tenant: error on the dashboard")
    void unknownTenant() {
        when(tenantRepository.findById(TENANT_ID)).thenReturn(Optional.empty());

        CallbackResult result = handler.handle(context("4242", "install"));

        assertEquals("/", result.redirectTo());
        assertEquals("Team not found.", result.messages().get(0).text());
        verifyNoInteractions(appClient);
    }
}
