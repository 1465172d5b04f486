package com.yoursp.oauthconnect.modules.state;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-flow rules: the tenant-id requirement class and where to send the
 * caller when anything in that flow fails.
 */
@Component
public class FlowRegistry {

    /** Used when the flow kind is unknown (e.g. the state itself failed to decode). */
    public static final String FALLBACK_REDIRECT = "/";

    public static final String DASHBOARD_PATH = "/";
    public static final String LOGIN_PATH = "/accounts/login";
    public static final String ONBOARDING_START_PATH = "/onboarding/start";
    public static final String INTEGRATIONS_HOME_PATH = "/integrations";

    private static final Map<FlowKind, TenantRequirement> REQUIREMENTS = new EnumMap<>(FlowKind.class);
    private static final Map<FlowKind, String> FAILURE_REDIRECTS = new EnumMap<>(FlowKind.class);

    static {
        register(FlowKind.LOGIN, TenantRequirement.FORBIDDEN, LOGIN_PATH);
        register(FlowKind.ONBOARDING, TenantRequirement.FORBIDDEN, ONBOARDING_START_PATH);
        register(FlowKind.INTEGRATION, TenantRequirement.REQUIRED, INTEGRATIONS_HOME_PATH);
        register(FlowKind.GITHUB_APP_INSTALL, TenantRequirement.REQUIRED, INTEGRATIONS_HOME_PATH);
        register(FlowKind.JIRA_ONBOARDING, TenantRequirement.OPTIONAL, "/onboarding/jira");
        register(FlowKind.JIRA_INTEGRATION, TenantRequirement.REQUIRED, INTEGRATIONS_HOME_PATH);
        register(FlowKind.SLACK_ONBOARDING, TenantRequirement.OPTIONAL, "/onboarding/slack");
        register(FlowKind.SLACK_INTEGRATION, TenantRequirement.REQUIRED, INTEGRATIONS_HOME_PATH);
    }

    private static void register(FlowKind kind, TenantRequirement requirement, String failureRedirect) {
        REQUIREMENTS.put(kind, requirement);
        FAILURE_REDIRECTS.put(kind, failureRedirect);
    }

    public boolean isValid(String wireValue) {
        return FlowKind.fromWireValue(wireValue).isPresent();
    }

    public TenantRequirement requirement(FlowKind kind) {
        return REQUIREMENTS.get(kind);
    }

    /**
     * @param kind flow kind, or {@code null} when it could not be determined
     * @return the flow's failure redirect, or {@link #FALLBACK_REDIRECT}
     */
    public String failureRedirect(FlowKind kind) {
        if (kind == null) {
            return FALLBACK_REDIRECT;
        }
        return FAILURE_REDIRECTS.getOrDefault(kind, FALLBACK_REDIRECT);
    }
}
