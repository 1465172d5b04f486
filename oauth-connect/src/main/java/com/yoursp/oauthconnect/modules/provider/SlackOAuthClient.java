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
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Slack OAuth v2 client. A bot token is bound to exactly one workspace,
 * so {@link #listResources(String)} returns that workspace alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlackOAuthClient implements ProviderClient {

    private final OAuthProviderProperties properties;
    private final RestTemplate restTemplate;

    @Override
    public Provider provider() {
        return Provider.SLACK;
    }

    @Override
    @CircuitBreaker(name = "slackOAuth", fallbackMethod = "exchangeFallback")
    public ProviderToken exchangeCodeForToken(String code, String redirectUri) {
        OAuthProviderProperties.Settings settings = properties.getSlack();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(settings.getClientId(), settings.getClientSecret());

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("redirect_uri", redirectUri);

        log.debug("Exchanging Slack auth code at {}", settings.getTokenUrl());

        Map<String, Object> tokenData = restTemplate.exchange(
                settings.getTokenUrl(),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                JsonBodies.OBJECT).getBody();

        requireOk(tokenData, "oauth.v2.access");
        Object accessToken = tokenData.get("access_token");
        if (accessToken == null) {
            throw new ProviderException(Provider.SLACK, "Slack token response has no access_token");
        }
        return ProviderToken.of(accessToken.toString());
    }

    @Override
    @CircuitBreaker(name = "slackOAuth", fallbackMethod = "listFallback")
    public List<ProviderResource> listResources(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);

        Map<String, Object> authTest = restTemplate.exchange(
                properties.getSlack().getApiBaseUrl() + "/auth.test",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                JsonBodies.OBJECT).getBody();

        requireOk(authTest, "auth.test");
        if (authTest.get("team_id") == null) {
            return List.of();
        }
        return List.of(new ProviderResource(
                (String) authTest.get("team_id"),
                (String) authTest.get("team"),
                (String) authTest.get("url")));
    }

    /** Slack answers HTTP 200 with {@code "ok": false} on failure. */
    private void requireOk(Map<String, Object> body, String method) {
        if (body == null || !Boolean.TRUE.equals(body.get("ok"))) {
            Object error = body != null ? body.get("error") : "empty body";
            throw new ProviderException(Provider.SLACK, "Slack " + method + " failed: " + error);
        }
    }

    @SuppressWarnings("unused")
    private ProviderToken exchangeFallback(String code, String redirectUri, Throwable t) {
        throw translate("token exchange", t);
    }

    @SuppressWarnings("unused")
    private List<ProviderResource> listFallback(String accessToken, Throwable t) {
        throw translate("workspace lookup", t);
    }

    private ProviderException translate(String operation, Throwable t) {
        if (t instanceof ProviderException pe) {
            return pe;
        }
        return new ProviderException(Provider.SLACK, "Slack " + operation + " failed: " + t.getMessage(), t);
    }
}
