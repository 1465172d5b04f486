package com.yoursp.oauthconnect.modules.state;

import com.yoursp.oauthconnect.modules.provider.Provider;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of reasons an OAuth redirect was started.
 * The wire value is what travels inside the state token as {@code type}.
 */
public enum FlowKind {

    LOGIN("login", Provider.GITHUB),
    ONBOARDING("onboarding", Provider.GITHUB),
    INTEGRATION("integration", Provider.GITHUB),
    GITHUB_APP_INSTALL("github_app_team", Provider.GITHUB),
    JIRA_ONBOARDING("jira_onboarding", Provider.JIRA),
    JIRA_INTEGRATION("jira_integration", Provider.JIRA),
    SLACK_ONBOARDING("slack_onboarding", Provider.SLACK),
    SLACK_INTEGRATION("slack_integration", Provider.SLACK);

    private final String wireValue;
    private final Provider provider;

    FlowKind(String wireValue, Provider provider) {
        this.wireValue = wireValue;
        this.provider = provider;
    }

    public String wireValue() {
        return wireValue;
    }

    public Provider provider() {
        return provider;
    }

    /** The callback carries an {@code installation_id} instead of an authorization code. */
    public boolean grantsInstallation() {
        return this == GITHUB_APP_INSTALL;
    }

    public static Optional<FlowKind> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.wireValue.equals(value))
                .findFirst();
    }

    /** The integration-class kind for a provider (tenant-bearing, started from inside the product). */
    public static FlowKind integrationFor(Provider provider) {
        return switch (provider) {
            case GITHUB -> INTEGRATION;
            case JIRA -> JIRA_INTEGRATION;
            case SLACK -> SLACK_INTEGRATION;
        };
    }

    public static FlowKind onboardingFor(Provider provider) {
        return switch (provider) {
            case GITHUB -> ONBOARDING;
            case JIRA -> JIRA_ONBOARDING;
            case SLACK -> SLACK_ONBOARDING;
        };
    }
}
