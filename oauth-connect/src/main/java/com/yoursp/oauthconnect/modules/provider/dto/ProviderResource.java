package com.yoursp.oauthconnect.modules.provider.dto;

/**
 * A provider-side object a tenant can connect to: a GitHub organization,
 * a Jira site or a Slack workspace.
 */
public record ProviderResource(
        String id,
        String name,
        String url) {
}
