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
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Connects a provider to an existing tenant from inside the product.
 * <p>
 * The credential is upserted as soon as the listing is non-empty, so
 * repeated attempts replace the token instead of adding rows. One resource
 * connects immediately; several go to the selection step.
 * </p>
 */
@Slf4j
public class IntegrationHandler implements FlowHandler {

    private final Provider provider;
    private final FlowKind flowKind;
    private final ProviderClient client;
    private final TenantRepository tenantRepository;
    private final MembershipRepository membershipRepository;
    private final IntegrationService integrationService;
    private final IntegrationConnector connector;
    private final PendingSelectionStore pendingSelectionStore;
    private final Clock clock;

    public IntegrationHandler(ProviderClient client,
            TenantRepository tenantRepository,
            MembershipRepository membershipRepository,
            IntegrationService integrationService,
            IntegrationConnector connector,
            PendingSelectionStore pendingSelectionStore,
            Clock clock) {
        this.provider = client.provider();
        this.flowKind = FlowKind.integrationFor(provider);
        this.client = client;
        this.tenantRepository = tenantRepository;
        this.membershipRepository = membershipRepository;
        this.integrationService = integrationService;
        this.connector = connector;
        this.pendingSelectionStore = pendingSelectionStore;
        this.clock = clock;
    }

    @Override
    public CallbackResult handle(CallbackContext context) {
        User caller = context.caller();

        Optional<Tenant> tenant = tenantRepository.findById(context.tenantId());
        if (tenant.isEmpty()) {
            return CallbackResult.error(FlowRegistry.DASHBOARD_PATH, "Team not found.");
        }
        Long tenantId = tenant.get().getId();

        if (!membershipRepository.existsByTenantIdAndUserId(tenantId, caller.getId())) {
            log.warn("User {} tried to connect {} to tenant {} without membership", caller.getId(), provider, tenantId);
            return CallbackResult.error(FlowRegistry.DASHBOARD_PATH, "You don't have access to this team.");
        }

        ProviderToken token;
        try {
            token = client.exchangeCodeForToken(context.code(), context.redirectUri());
        } catch (ProviderException e) {
            log.error("{} token exchange failed: {}", provider.displayName(), e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH,
                    "Failed to connect to " + provider.displayName() + ". Please try again.");
        }

        List<ProviderResource> resources;
        try {
            resources = client.listResources(token.accessToken());
        } catch (ProviderException e) {
            log.error("Failed to get {} {}: {}", provider.displayName(), provider.resourceLabel(), e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH,
                    "Failed to get " + provider.resourceLabel() + " from " + provider.displayName()
                            + ". Please try again.");
        }

        if (resources.isEmpty()) {
            return CallbackResult.error(FlowRegistry.INTEGRATIONS_HOME_PATH,
                    "No " + provider.resourceLabel() + " found.");
        }

        Long credentialId = integrationService.upsertCredential(tenantId, provider, token, caller.getId());

        if (resources.size() == 1) {
            return connect(caller, tenantId, credentialId, resources.get(0));
        }

        pendingSelectionStore.save(context.sessionHandle(),
                new PendingSelection(provider, flowKind, tenantId, null, resources, clock.instant()));
        return CallbackResult.redirect("/integrations/" + provider.slug() + "/select");
    }

    @Override
    public CallbackResult completeSelection(User caller, PendingSelection selection, ProviderResource chosen) {
        if (!membershipRepository.existsByTenantIdAndUserId(selection.tenantId(), caller.getId())) {
            return CallbackResult.error(FlowRegistry.DASHBOARD_PATH, "You don't have access to this team.");
        }
        Long credentialId = integrationService.requireCredentialId(selection.tenantId(), provider);
        return connect(caller, selection.tenantId(), credentialId, chosen);
    }

    private CallbackResult connect(User caller, Long tenantId, Long credentialId, ProviderResource resource) {
        connector.connect(tenantId, provider, credentialId, resource, caller.getId(), "integration");
        return CallbackResult.success(FlowRegistry.INTEGRATIONS_HOME_PATH, "Connected to " + resource.name() + ".");
    }
}
