package com.yoursp.oauthconnect.config;

import com.yoursp.oauthconnect.modules.provider.Provider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code oauth.providers.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "oauth.providers")
public class OAuthProviderProperties {

    @Valid
    private Settings github = new Settings();
    @Valid
    private Settings jira = new Settings();
    @Valid
    private Settings slack = new Settings();

    public Settings forProvider(Provider provider) {
        return switch (provider) {
            case GITHUB -> github;
            case JIRA -> jira;
            case SLACK -> slack;
        };
    }

    @Getter
    @Setter
    public static class Settings {

        private String clientId;
        private String clientSecret;

        /** Scope requested when the provider is only used to sign in. */
        private String minimalScope;

        /** Scope requested when connecting the provider to a tenant. */
        private String fullScope;

        @NotBlank
        private String authorizeUrl;
        @NotBlank
        private String tokenUrl;
        @NotBlank
        private String apiBaseUrl;

        /** GitHub App slug, used for the installation URL. */
        private String appName;

        /** Numeric GitHub App id, the issuer of app JWTs. */
        private String appId;

        /** GitHub App private key, PKCS#8 PEM. */
        private String appPrivateKey;
    }
}
