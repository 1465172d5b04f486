package com.yoursp.oauthconnect.modules.callback.handler;

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
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.ProvisionedTenant;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.service.TokenCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;

/**
 * First onboarding step: create the caller's tenant from a GitHub organization.
 * <ul>
 * <li>Caller already has a tenant: no-op, dashboard</li>
 * <li>No organizations: error</li>
 * <li>One organization: tenant created immediately</li>
 * <li>Several: stash them (with the encrypted token) for the selection step</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class GitHubOnboardingHandler implements FlowHandler {

    static final String SELECT_ORG_PATH = "/onboarding/github/select";
    static final String NEXT_STEP_PATH = "/onboarding/repositories";

    private final ProviderClient client;
    private final IntegrationConnector connector;
    private final PendingSelectionStore pendingSelectionStore;
    private final MembershipRepository membershipRepository;
    private final TokenCipher tokenCipher;
    private final Clock clock;

    @Override
    public CallbackResult handle(CallbackContext context) {
        User caller = context.caller();
        if (membershipRepository.existsByUserId(caller.getId())) {
            return CallbackResult.redirect(FlowRegistry.DASHBOARD_PATH);
        }

        ProviderToken token;
        List<ProviderResource> orgs;
        try {
            token = client.exchangeCodeForToken(context.code(), context.redirectUri());
            orgs = client.listResources(token.accessToken());
        } catch (ProviderException e) {
            log.error("GitHub OAuth error during onboarding: {}", e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.ONBOARDING_START_PATH,
                    "Failed to connect to GitHub. Please try again.");
        }

        if (orgs.isEmpty()) {
            return CallbackResult.error(FlowRegistry.ONBOARDING_START_PATH,
                    "No GitHub organizations found. You need to be a member of at least one organization.");
        }

        if (orgs.size() == 1) {
            return createTenant(caller, orgs.get(0), token);
        }

        pendingSelectionStore.save(context.sessionHandle(), new PendingSelection(
                Provider.GITHUB,
                FlowKind.ONBOARDING,
                null,
                tokenCipher.encrypt(token.accessToken()),
                orgs,
                clock.instant()));
        log.info("User {} belongs to {} GitHub organizations, awaiting selection", caller.getId(), orgs.size());
        return CallbackResult.redirect(SELECT_ORG_PATH);
    }

    @Override
    public CallbackResult completeSelection(User caller, PendingSelection selection, ProviderResource chosen) {
        if (membershipRepository.existsByUserId(caller.getId())) {
            return CallbackResult.redirect(FlowRegistry.DASHBOARD_PATH);
        }
        ProviderToken token = ProviderToken.of(tokenCipher.decrypt(selection.encryptedAccessToken()));
        return createTenant(caller, chosen, token);
    }

    private CallbackResult createTenant(User caller, ProviderResource org, ProviderToken token) {
        ProvisionedTenant provisioned;
        try {
            provisioned = connector.provisionTenant(caller.getId(), Provider.GITHUB, org, token);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to create team from organization {}: {}", org.name(), e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.ONBOARDING_START_PATH, "Failed to create team. Please try again.");
        }

        return CallbackResult.success(NEXT_STEP_PATH,
                "Team '" + provisioned.tenant().getName() + "' created successfully!");
    }
}
