package com.yoursp.oauthconnect.modules.callback;

import com.yoursp.oauthconnect.modules.auth.AccountResolutionService;
import com.yoursp.oauthconnect.modules.auth.SessionService;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandler;
import com.yoursp.oauthconnect.modules.callback.handler.FlowHandlerRegistry;
import com.yoursp.oauthconnect.modules.callback.handler.GitHubAppInstallHandler;
import com.yoursp.oauthconnect.modules.callback.handler.GitHubLoginHandler;
import com.yoursp.oauthconnect.modules.callback.handler.GitHubOnboardingHandler;
import com.yoursp.oauthconnect.modules.callback.handler.IntegrationHandler;
import com.yoursp.oauthconnect.modules.callback.handler.ProviderOnboardingHandler;
import com.yoursp.oauthconnect.modules.provider.GitHubAppClient;
import com.yoursp.oauthconnect.modules.provider.GitHubOAuthClient;
import com.yoursp.oauthconnect.modules.provider.JiraOAuthClient;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.ProviderClient;
import com.yoursp.oauthconnect.modules.provider.SlackOAuthClient;
import com.yoursp.oauthconnect.modules.selection.PendingSelectionStore;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.state.StateTokenCodec;
import com.yoursp.oauthconnect.modules.tenant.IntegrationConnector;
import com.yoursp.oauthconnect.modules.tenant.IntegrationService;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.repository.TenantRepository;
import com.yoursp.oauthconnect.service.AuditService;
import com.yoursp.oauthconnect.service.TokenCipher;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the eight flow handlers and one {@link OAuthCallbackDispatcher}
 * per provider.
 */
@Configuration
@RequiredArgsConstructor
public class CallbackDispatcherConfig {

    private final IntegrationService integrationService;
    private final IntegrationConnector connector;
    private final PendingSelectionStore pendingSelectionStore;
    private final MembershipRepository membershipRepository;
    private final TenantRepository tenantRepository;
    private final FlowRegistry flowRegistry;
    private final Clock clock;

    @Bean
    public FlowHandlerRegistry flowHandlerRegistry(GitHubOAuthClient github,
            GitHubAppClient githubApp,
            JiraOAuthClient jira,
            SlackOAuthClient slack,
            AccountResolutionService accountResolutionService,
            SessionService sessionService,
            AuditService auditService,
            TokenCipher tokenCipher) {
        Map<FlowKind, FlowHandler> handlers = new EnumMap<>(FlowKind.class);

        handlers.put(FlowKind.LOGIN, new GitHubLoginHandler(
                github, accountResolutionService, sessionService, membershipRepository, auditService));
        handlers.put(FlowKind.ONBOARDING, new GitHubOnboardingHandler(
                github, connector, pendingSelectionStore, membershipRepository, tokenCipher, clock));
        handlers.put(FlowKind.JIRA_ONBOARDING, onboardingHandler(jira, "/onboarding/jira/projects"));
        handlers.put(FlowKind.SLACK_ONBOARDING, onboardingHandler(slack, "/onboarding/complete"));

        handlers.put(FlowKind.INTEGRATION, integrationHandler(github));
        handlers.put(FlowKind.GITHUB_APP_INSTALL, new GitHubAppInstallHandler(
                githubApp, tenantRepository, membershipRepository, integrationService, connector));
        handlers.put(FlowKind.JIRA_INTEGRATION, integrationHandler(jira));
        handlers.put(FlowKind.SLACK_INTEGRATION, integrationHandler(slack));

        return new FlowHandlerRegistry(handlers);
    }

    @Bean
    public OAuthCallbackDispatcher githubCallbackDispatcher(StateTokenCodec codec, FlowHandlerRegistry handlers) {
        return new OAuthCallbackDispatcher(Provider.GITHUB, codec, flowRegistry, handlers);
    }

    @Bean
    public OAuthCallbackDispatcher jiraCallbackDispatcher(StateTokenCodec codec, FlowHandlerRegistry handlers) {
        return new OAuthCallbackDispatcher(Provider.JIRA, codec, flowRegistry, handlers);
    }

    @Bean
    public OAuthCallbackDispatcher slackCallbackDispatcher(StateTokenCodec codec, FlowHandlerRegistry handlers) {
        return new OAuthCallbackDispatcher(Provider.SLACK, codec, flowRegistry, handlers);
    }

    private ProviderOnboardingHandler onboardingHandler(ProviderClient client, String nextStepPath) {
        return new ProviderOnboardingHandler(client, nextStepPath, integrationService, connector,
                pendingSelectionStore, membershipRepository, flowRegistry, clock);
    }

    private IntegrationHandler integrationHandler(ProviderClient client) {
        return new IntegrationHandler(client, tenantRepository, membershipRepository, integrationService,
                connector, pendingSelectionStore, clock);
    }
}
