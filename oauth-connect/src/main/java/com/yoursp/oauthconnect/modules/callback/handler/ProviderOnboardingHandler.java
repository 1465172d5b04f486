package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.Membership;
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
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Onboarding step that attaches a second provider (Jira, Slack) to the
 * tenant the caller created from GitHub.
 */
@Slf4j
public class ProviderOnboardingHandler implements FlowHandler {

    private final Provider provider;
    private final FlowKind flowKind;
    private final String nextStepPath;
    private final ProviderClient client;
    private final IntegrationService integrationService;
    private final IntegrationConnector connector;
    private final PendingSelectionStore pendingSelectionStore;
    private final MembershipRepository membershipRepository;
    private final FlowRegistry flowRegistry;
    private final Clock clock;

    public ProviderOnboardingHandler(ProviderClient client,
            String nextStepPath,
            IntegrationService integrationService,
            IntegrationConnector connector,
            PendingSelectionStore pendingSelectionStore,
            MembershipRepository membershipRepository,
            FlowRegistry flowRegistry,
            Clock clock) {
        this.provider = client.provider();
        this.flowKind = FlowKind.onboardingFor(provider);
        this.nextStepPath = nextStepPath;
        this.client = client;
        this.integrationService = integrationService;
        this.connector = connector;
        this.pendingSelectionStore = pendingSelectionStore;
        this.membershipRepository = membershipRepository;
        this.flowRegistry = flowRegistry;
        this.clock = clock;
    }

    @Override
    public CallbackResult handle(CallbackContext context) {
        User caller = context.caller();
        String failureRedirect = flowRegistry.failureRedirect(flowKind);

        Optional<Membership> membership = membershipRepository.findFirstByUserIdOrderByCreatedAtAsc(caller.getId());
        if (membership.isEmpty()) {
            return CallbackResult.error(FlowRegistry.ONBOARDING_START_PATH, "Please complete GitHub setup first.");
        }
        Long tenantId = membership.get().getTenantId();

        if (context.tenantId() != null && !context.tenantId().equals(tenantId)) {
            log.warn("{} onboarding state names tenant {} but user {} onboards tenant {}",
                    provider, context.tenantId(), caller.getId(), tenantId);
            return CallbackResult.error(failureRedirect, "Invalid team context.");
        }

        ProviderToken token;
        List<ProviderResource> resources;
        try {
            token = client.exchangeCodeForToken(context.code(), context.redirectUri());
            resources = client.listResources(token.accessToken());
        } catch (ProviderException e) {
            log.error("{} OAuth error during onboarding: {}", provider.displayName(), e.getMessage(), e);
            return CallbackResult.error(failureRedirect,
                    "Failed to connect to " + provider.displayName() + ". Please try again.");
        }

        if (resources.isEmpty()) {
            return CallbackResult.error(failureRedirect, "No " + provider.resourceLabel() + " found.");
        }

        Long credentialId = integrationService.upsertCredential(tenantId, provider, token, caller.getId());

        if (resources.size() == 1) {
            return connect(caller, tenantId, credentialId, resources.get(0));
        }

        pendingSelectionStore.save(context.sessionHandle(),
                new PendingSelection(provider, flowKind, tenantId, null, resources, clock.instant()));
        return CallbackResult.redirect("/onboarding/" + provider.slug() + "/select");
    }

    @Override
    public CallbackResult completeSelection(User caller, PendingSelection selection, ProviderResource chosen) {
        Long credentialId = integrationService.requireCredentialId(selection.tenantId(), provider);
        return connect(caller, selection.tenantId(), credentialId, chosen);
    }

    private CallbackResult connect(User caller, Long tenantId, Long credentialId, ProviderResource resource) {
        connector.connect(tenantId, provider, credentialId, resource, caller.getId(), "onboarding");
        return CallbackResult.success(nextStepPath,
                "Connected to " + provider.displayName() + ": " + resource.name());
    }
}
