package com.yoursp.oauthconnect.modules.provider;

import com.yoursp.oauthconnect.config.OAuthProviderProperties;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderResource;
import com.yoursp.oauthconnect.modules.provider.dto.ProviderToken;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Atlassian (Jira Cloud) OAuth 2.0 (3LO) client.
 * <ul>
 * <li>Token exchange posts a JSON body, returns access + refresh token</li>
 * <li>Resources are the sites from {@code /oauth/token/accessible-resources}</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JiraOAuthClient implements ProviderClient {

    private final OAuthProviderProperties properties;
    private final RestTemplate restTemplate;

    @Override
    public Provider provider() {
        return Provider.JIRA;
    }

    @Override
    @CircuitBreaker(name = "jiraOAuth", fallbackMethod = "exchangeFallback")
    public ProviderToken exchangeCodeForToken(String code, String redirectUri) {
        OAuthProviderProperties.Settings settings = properties.getJira();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, String> body = Map.of(
                "grant_type", "authorization_code",
                "client_id", settings.getClientId(),
                "client_secret", settings.getClientSecret(),
                "code", code,
                "redirect_uri", redirectUri);

        log.debug("Exchanging Jira auth code at {}", settings.getTokenUrl());

        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                settings.getTokenUrl(),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                JsonBodies.OBJECT);

        Map<String, Object> tokenData = response.getBody();
        if (tokenData == null || tokenData.get("access_token") == null) {
            throw new ProviderException(Provider.JIRA, "Jira token response has no access_token");
        }
        Object refreshToken = tokenData.get("refresh_token");
        Object expiresIn = tokenData.get("expires_in");
        return new ProviderToken(
                tokenData.get("access_token").toString(),
                refreshToken != null ? refreshToken.toString() : null,
                expiresIn instanceof Number n ? n.longValue() : null);
    }

    @Override
    @CircuitBreaker(name = "jiraOAuth", fallbackMethod = "listFallback")
    public List<ProviderResource> listResources(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        List<Map<String, Object>> sites = restTemplate.exchange(
                properties.getJira().getApiBaseUrl() + "/oauth/token/accessible-resources",
                HttpMethod.GET,
                new HttpEntity<>(headers),
                JsonBodies.ARRAY).getBody();

        if (sites == null) {
            return List.of();
        }
        return sites.stream()
                .map(site -> new ProviderResource(
                        (String) site.get("id"),
                        (String) site.get("name"),
                        (String) site.get("url")))
                .toList();
    }

    @SuppressWarnings("unused")
    private ProviderToken exchangeFallback(String code, String redirectUri, Throwable t) {
        throw translate("token exchange", t);
    }

    @SuppressWarnings("unused")
    private List<ProviderResource> listFallback(String accessToken, Throwable t) {
        throw translate("site listing", t);
    }

    private ProviderException translate(String operation, Throwable t) {
        if (t instanceof ProviderException pe) {
            return pe;
        }
        return new ProviderException(Provider.JIRA, "Jira " + operation + " failed: " + t.getMessage(), t);
    }
}
