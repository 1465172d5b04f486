package com.yoursp.oauthconnect.modules.provider;

import com.yoursp.oauthconnect.config.OAuthProviderProperties;
import com.yoursp.oauthconnect.modules.provider.dto.ExternalIdentity;
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
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * GitHub OAuth App client: code exchange, user profile, verified email and
 * organization listing. Protected by the {@code githubOAuth} circuit breaker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GitHubOAuthClient implements IdentityProviderClient {

    private final OAuthProviderProperties properties;
    private final RestTemplate restTemplate;

    @Override
    public Provider provider() {
        return Provider.GITHUB;
    }

    @Override
    @CircuitBreaker(name = "githubOAuth", fallbackMethod = "exchangeFallback")
    public ProviderToken exchangeCodeForToken(String code, String redirectUri) {
        OAuthProviderProperties.Settings settings = properties.getGithub();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", settings.getClientId());
        body.add("client_secret", settings.getClientSecret());
        body.add("code", code);
        body.add("redirect_uri", redirectUri);

        log.debug("Exchanging GitHub auth code at {}", settings.getTokenUrl());

        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                settings.getTokenUrl(),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                JsonBodies.OBJECT);

        Map<String, Object> tokenData = response.getBody();
        // GitHub reports exchange errors with HTTP 200
        if (tokenData == null || tokenData.get("error") != null) {
            String reason = tokenData != null ? String.valueOf(tokenData.get("error_description")) : "empty body";
            throw new ProviderException(Provider.GITHUB, "GitHub token exchange failed: " + reason);
        }
        Object accessToken = tokenData.get("access_token");
        if (accessToken == null) {
            throw new ProviderException(Provider.GITHUB, "GitHub token response has no access_token");
        }
        return ProviderToken.of(accessToken.toString());
    }

    @Override
    @CircuitBreaker(name = "githubOAuth", fallbackMethod = "listFallback")
    public List<ProviderResource> listResources(String accessToken) {
        List<Map<String, Object>> orgs = restTemplate.exchange(
                apiUrl("/user/orgs"),
                HttpMethod.GET,
                new HttpEntity<>(bearer(accessToken)),
                JsonBodies.ARRAY).getBody();

        if (orgs == null) {
            return List.of();
        }
        return orgs.stream()
                .map(org -> new ProviderResource(
                        String.valueOf(org.get("id")),
                        (String) org.get("login"),
                        "https://github.com/" + org.get("login")))
                .toList();
    }

    @Override
    @CircuitBreaker(name = "githubOAuth", fallbackMethod = "identityFallback")
    public ExternalIdentity getIdentity(String accessToken) {
        Map<String, Object> user = restTemplate.exchange(
                apiUrl("/user"),
                HttpMethod.GET,
                new HttpEntity<>(bearer(accessToken)),
                JsonBodies.OBJECT).getBody();

        if (user == null || user.get("id") == null) {
            throw new ProviderException(Provider.GITHUB, "GitHub /user returned no id");
        }
        return new ExternalIdentity(
                String.valueOf(user.get("id")),
                (String) user.get("login"),
                (String) user.get("email"),
                (String) user.get("name"));
    }

    @Override
    @CircuitBreaker(name = "githubOAuth", fallbackMethod = "emailFallback")
    public Optional<String> getVerifiedEmail(String accessToken) {
        List<Map<String, Object>> emails = restTemplate.exchange(
                apiUrl("/user/emails"),
                HttpMethod.GET,
                new HttpEntity<>(bearer(accessToken)),
                JsonBodies.ARRAY).getBody();

        if (emails == null) {
            return Optional.empty();
        }
        return emails.stream()
                .filter(e -> Boolean.TRUE.equals(e.get("primary")) && Boolean.TRUE.equals(e.get("verified")))
                .map(e -> (String) e.get("email"))
                .filter(Objects::nonNull)
                .findFirst();
    }

    private String apiUrl(String path) {
        return properties.getGithub().getApiBaseUrl() + path;
    }

    private HttpHeaders bearer(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.valueOf("application/vnd.github+json")));
        return headers;
    }

    // ================================================================
    // Circuit breaker fallbacks
    // ================================================================

    @SuppressWarnings("unused")
    private ProviderToken exchangeFallback(String code, String redirectUri, Throwable t) {
        throw translate("token exchange", t);
    }

    @SuppressWarnings("unused")
    private List<ProviderResource> listFallback(String accessToken, Throwable t) {
        throw translate("organization listing", t);
    }

    @SuppressWarnings("unused")
    private ExternalIdentity identityFallback(String accessToken, Throwable t) {
        throw translate("user lookup", t);
    }

    @SuppressWarnings("unused")
    private Optional<String> emailFallback(String accessToken, Throwable t) {
        throw translate("email lookup", t);
    }

    private ProviderException translate(String operation, Throwable t) {
        if (t instanceof ProviderException pe) {
            return pe;
        }
        if (!(t instanceof RestClientException)) {
            log.warn("GitHub {} short-circuited: {}", operation, t.getMessage());
        }
        return new ProviderException(Provider.GITHUB, "GitHub " + operation + " failed: " + t.getMessage(), t);
    }
}
