package com.yoursp.oauthconnect.modules.connect;

import com.yoursp.oauthconnect.config.OAuthProviderProperties;
import com.yoursp.oauthconnect.modules.provider.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds provider authorize URLs and the shared callback URI.
 * Every flow of a provider comes back to the same {@code /auth/{provider}/callback}.
 */
@Component
@RequiredArgsConstructor
public class AuthorizeUrlBuilder {

    private static final String GITHUB_APP_INSTALL_URL = "https://github.com/apps/{appName}/installations/new";

    private final OAuthProviderProperties properties;

    @Value("${app.base-url}")
    private String appBaseUrl;

    public String callbackUri(Provider provider) {
        return appBaseUrl + "/auth/" + provider.slug() + "/callback";
    }

    /**
     * @param provider provider to authorize against
     * @param fullScope {@code true} for tenant connections, {@code false} for sign-in
     * @param state     signed state token
     */
    public String authorizeUrl(Provider provider, boolean fullScope, String state) {
        OAuthProviderProperties.Settings settings = properties.forProvider(provider);
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.getAuthorizeUrl())
                .queryParam("client_id", settings.getClientId())
                .queryParam("redirect_uri", callbackUri(provider))
                .queryParam("scope", fullScope ? settings.getFullScope() : settings.getMinimalScope())
                .queryParam("state", state);

        switch (provider) {
            case JIRA -> builder
                    .queryParam("audience", "api.atlassian.com")
                    .queryParam("response_type", "code")
                    .queryParam("prompt", "consent");
            case SLACK, GITHUB -> {
            }
        }
        return builder.encode().build().toUriString();
    }

    /** GitHub App installation page, used instead of the OAuth App flow when an app name is configured. */
    public String githubAppInstallUrl(String state) {
        return UriComponentsBuilder.fromUriString(GITHUB_APP_INSTALL_URL)
                .queryParam("state", state)
                .encode()
                .buildAndExpand(properties.getGithub().getAppName())
                .toUriString();
    }
}
