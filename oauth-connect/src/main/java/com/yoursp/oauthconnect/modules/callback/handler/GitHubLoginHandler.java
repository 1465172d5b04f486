package com.yoursp.oauthconnect.modules.callback.handler;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.auth.AccountResolutionService;
import com.yoursp.oauthconnect.modules.auth.ResolvedAccount;
import com.yoursp.oauthconnect.modules.auth.SessionService;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackContext;
import com.yoursp.oauthconnect.modules.callback.dto.CallbackResult;
import com.yoursp.oauthconnect.modules.provider.IdentityProviderClient;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.provider.ProviderException;
import com.yoursp.oauthconnect.modules.provider.dto.ExternalIdentity;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import com.yoursp.oauthconnect.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sign in with GitHub: exchange the code, resolve or create the local user,
 * open a session, then send the user to onboarding or the dashboard.
 */
@Slf4j
@RequiredArgsConstructor
public class GitHubLoginHandler implements FlowHandler {

    private final IdentityProviderClient client;
    private final AccountResolutionService accountResolutionService;
    private final SessionService sessionService;
    private final MembershipRepository membershipRepository;
    private final AuditService auditService;

    @Override
    public CallbackResult handle(CallbackContext context) {
        ExternalIdentity identity;
        String email;
        try {
            ProviderToken token = client.exchangeCodeForToken(context.code(), context.redirectUri());
            identity = client.getIdentity(token.accessToken());
            email = identity.email() != null
                    ? identity.email()
                    : client.getVerifiedEmail(token.accessToken()).orElse(null);
        } catch (ProviderException e) {
            log.error("GitHub OAuth error during login: {}", e.getMessage(), e);
            return CallbackResult.error(FlowRegistry.LOGIN_PATH, "Failed to connect to GitHub. Please try again.");
        }

        ResolvedAccount account = accountResolutionService.resolve(Provider.GITHUB, identity, email);
        User user = account.user();
        auditAccount(account);

        String sessionToken = sessionService.createSession(user.getId(),
                context.client().ipAddress(), context.client().userAgent());

        String redirectTo = membershipRepository.existsByUserId(user.getId())
                ? FlowRegistry.DASHBOARD_PATH
                : FlowRegistry.ONBOARDING_START_PATH;

        log.info("GitHub login complete for user {} ({}), redirecting to {}",
                user.getId(), account.resolution(), redirectTo);
        return CallbackResult.redirect(redirectTo).withSession(sessionToken);
    }

    private void auditAccount(ResolvedAccount account) {
        String action = switch (account.resolution()) {
            case LINKED -> AuditService.LOGIN;
            case MATCHED_BY_EMAIL -> AuditService.ACCOUNT_LINKED;
            case CREATED -> AuditService.USER_REGISTERED;
        };
        String userId = account.user().getId().toString();
        auditService.log(account.user().getId(), null, action, "User", userId,
                Map.of("provider", Provider.GITHUB.slug(), "resolution", account.resolution().name()));
    }
}
