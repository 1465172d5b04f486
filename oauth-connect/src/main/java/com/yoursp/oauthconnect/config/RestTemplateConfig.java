package com.yoursp.oauthconnect.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Shared client for provider token exchanges and API listings.
 * GitHub rejects API calls without a User-Agent, so every request names the service.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(
            @Value("${oauth.http.connect-timeout:10s}") Duration connectTimeout,
            @Value("${oauth.http.read-timeout:30s}") Duration readTimeout,
            @Value("${spring.application.name:oauth-connect}") String applicationName) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());

        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.getInterceptors().add(userAgent(applicationName));
        return restTemplate;
    }

    static ClientHttpRequestInterceptor userAgent(String applicationName) {
        return (request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.USER_AGENT, applicationName);
            return execution.execute(request, body);
        };
    }
}
