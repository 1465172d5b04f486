package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.Membership;
import com.yoursp.oauthconnect.model.entity.Tenant;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.callback.dto.ProviderCallbackRequest;
import com.yoursp.oauthconnect.modules.provider.GitHubAppClient;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.ProviderException;
import com.yoursp.oauthconnect.modules.provider.dto.GitHubInstallation;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Finishes a GitHub App installation started for a tenant.
 * <p>
 * GitHub returns {@code installation_id} instead of an authorization code.
 * The installation is verified with an app JWT, an installation token is
 * stored as the tenant's GitHub credential and the installed account
 * becomes the tenant's GitHub integration. An install that still awaits an
 * organization owner's approval ({@code setup_action=request}) only reports
 * that it is pending.
 * </p>
 */
@Slf4j
public class GitHubAppInstallHandler implements FlowHandler {

    static final String REQUESTED_MESSAGE =
            "GitHub App installation requested. An organization owner must approve it.";
    static final String VERIFY_FAILED_MESSAGE = "Failed to verify the GitHub App installation. Please try again.";

    private final GitHubAppClient appClient;
    private final TenantRepository tenantRepository;
    private final MembershipRepository membershipRepository;
    private final IntegrationService integrationService;
    private final IntegrationConnector connector;

    public GitHubAppInstallHandler(GitHubAppClient appClient,
            TenantRepository tenantRepository,
            MembershipRepository membershipRepository,
            IntegrationService integrationService,
            IntegrationConnector connector) {
        this.appClient = appClient;
        this.tenantRepository = tenantRepository;
        this.membershipRepository = membershipRepository;
        this.integrationService = integrationService;
        this.connector = connector;
    }

    @Override
    public CallbackResult handle(CallbackContext context) {
        User caller = context.caller();

        Optional<Tenant> tenant = tenantRepository.findById(context.tenantId());
        if (tenant.isEmpty()) {
            return CallbackResult.error(FlowRegistry.DASHBOARD_PATH, "Team not found.");
        }
        Long tenantId = tenant.get().getId();

        boolean admin = membershipRepository.findByTenantIdAndUserId(tenantId, caller.getId())
                .map(Membership::isAdmin)
                .orElse(false);
        if (!admin) {
            log.warn("User {} tried to install the GitHub App for tenant {} without admin rights",
                    caller.getId(), tenantId);
            return CallbackResult.error(FlowRegistry.DASHBOARD_PATH, "You don't have access to this team.");
        }

        if (context.installationId() == null || context.installationId().isBlank()) {
            if (ProviderCallbackRequest.SETUP_ACTION_REQUEST.equals(context.setupAction())) {
                log.info("GitHub App install for tenant {} awaits owner approval", tenantId);
                return CallbackResult.info(FlowRegistry.INTEGRATIONS_HOME_PATH, REQUESTED_MESSAGE);
            }
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH, "No installation received from GitHub.");
        }

        long installationId;
        try {
            installationId = Long.parseLong(context.installationId().trim());
        } catch (NumberFormatException e) {
            log.warn("Malformed GitHub installation id '{}' for tenant {}", context.installationId(), tenantId);
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH, "Invalid GitHub App installation.");
        }

        GitHubInstallation installation;
        ProviderToken token;
        try {
            installation = appClient.getInstallation(installationId);
            token = appClient.createInstallationToken(installationId);
        } catch (ProviderException e) {
            log.error("GitHub App installation {} could not be verified: {}", installationId, e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH, VERIFY_FAILED_MESSAGE);
        }

        Long credentialId = integrationService.upsertInstallationCredential(
                tenantId, token, installationId, caller.getId());
        connector.connect(tenantId, Provider.GITHUB, credentialId, installation.account(), caller.getId(),
                FlowKind.GITHUB_APP_INSTALL.wireValue());

        log.info("GitHub App installation {} on {} connected to tenant {}",
                installationId, installation.account().name(), tenantId);
        return CallbackResult.success(FlowRegistry.INTEGRATIONS_HOME_PATH,
                "GitHub App installed for " + installation.account().name() + ".");
    }
}
