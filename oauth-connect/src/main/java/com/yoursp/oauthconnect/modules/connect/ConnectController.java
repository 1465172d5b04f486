package com.yoursp.oauthconnect.modules.connect;

import com.yoursp.oauthconnect.model.entity.Membership;
import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.modules.auth.SessionAuthFilter;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.StateTokenCodec;
import com.yoursp.oauthconnect.modules.tenant.TenantAccessException;
import com.yoursp.oauthconnect.repository.MembershipRepository;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

/**
 * Starts the authenticated flows: issues a state token for the flow and
 * redirects the caller to the provider's authorize page with the full scope.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ConnectController {

    private final StateTokenCodec stateTokenCodec;
    private final AuthorizeUrlBuilder authorizeUrlBuilder;
    private final MembershipRepository membershipRepository;

    @GetMapping("/connect/github/onboarding")
    public void githubOnboarding(@RequestAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE) User caller,
            HttpServletResponse response) throws IOException {
        String state = stateTokenCodec.encode(FlowKind.ONBOARDING, null);
        log.info("User {} starting GitHub onboarding", caller.getId());
        response.sendRedirect(authorizeUrlBuilder.authorizeUrl(Provider.GITHUB, true, state));
    }

    /**
     * Jira and Slack onboarding. The state carries the caller's tenant when
     * one exists so the callback can reject a mismatched team.
     */
    @GetMapping("/connect/{provider}/onboarding")
    public void providerOnboarding(@PathVariable("provider") String providerSlug,
            @RequestAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE) User caller,
            HttpServletResponse response) throws IOException {
        Provider provider = provider(providerSlug);
        Long tenantId = membershipRepository.findFirstByUserIdOrderByCreatedAtAsc(caller.getId())
                .map(Membership::getTenantId)
                .orElse(null);

        String state = stateTokenCodec.encode(FlowKind.onboardingFor(provider), tenantId);
        log.info("User {} starting {} onboarding (tenant={})", caller.getId(), provider.displayName(), tenantId);
        response.sendRedirect(authorizeUrlBuilder.authorizeUrl(provider, true, state));
    }

    @GetMapping("/teams/{tenantId}/connect/{provider}")
    public void integration(@PathVariable("tenantId") Long tenantId,
            @PathVariable("provider") String providerSlug,
            @RequestAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE) User caller,
            HttpServletResponse response) throws IOException {
        Provider provider = provider(providerSlug);
        requireAdmin(tenantId, caller);

        String state = stateTokenCodec.encode(FlowKind.integrationFor(provider), tenantId);
        log.info("User {} connecting {} to tenant {}", caller.getId(), provider.displayName(), tenantId);
        response.sendRedirect(authorizeUrlBuilder.authorizeUrl(provider, true, state));
    }

    /**
     * GitHub App installation. GitHub returns to the GitHub callback (the
     * app's setup URL) with the state, {@code installation_id} and
     * {@code setup_action}.
     */
    @GetMapping("/teams/{tenantId}/connect/github/app")
    public void githubAppInstall(@PathVariable("tenantId") Long tenantId,
            @RequestAttribute(SessionAuthFilter.CURRENT_USER_ATTRIBUTE) User caller,
            HttpServletResponse response) throws IOException {
        requireAdmin(tenantId, caller);

        String state = stateTokenCodec.encode(FlowKind.GITHUB_APP_INSTALL, tenantId);
        log.info("User {} installing the GitHub App for tenant {}", caller.getId(), tenantId);
        response.sendRedirect(authorizeUrlBuilder.githubAppInstallUrl(state));
    }

    private void requireAdmin(Long tenantId, User caller) {
        boolean admin = membershipRepository.findByTenantIdAndUserId(tenantId, caller.getId())
                .map(Membership::isAdmin)
                .orElse(false);
        if (!admin) {
            log.warn("User {} is not an admin of tenant {}", caller.getId(), tenantId);
            throw new TenantAccessException("Only team admins can connect integrations.");
        }
    }

    private static Provider provider(String slug) {
        return Provider.fromSlug(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + slug));
    }
}
