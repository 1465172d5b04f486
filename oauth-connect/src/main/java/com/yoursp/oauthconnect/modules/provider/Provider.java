package com.yoursp.oauthconnect.modules.provider;

import java.util.Arrays;
import java.util.Optional;

/**
 * External OAuth providers a tenant can connect to.
 * The slug is the path segment used in {@code /auth/{provider}/callback}.
 */
public enum Provider {

    GITHUB("github", "GitHub", "organizations"),
    JIRA("jira", "Jira", "Jira sites"),
    SLACK("slack", "Slack", "Slack workspaces");

    private final String slug;
    private final String displayName;
    private final String resourceLabel;

    Provider(String slug, String displayName, String resourceLabel) {
        this.slug = slug;
        this.displayName = displayName;
        this.resourceLabel = resourceLabel;
    }

    public String slug() {
        return slug;
    }

    public String displayName() {
        return displayName;
    }

    /** Plural name of the provider-side resource, used in user-facing messages. */
    public String resourceLabel() {
        return resourceLabel;
    }

    public static Optional<Provider> fromSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.slug.equalsIgnoreCase(slug))
                .findFirst();
    }
}
