package com.yoursp.oauthconnect.modules.provider.dto;

/**
 * A GitHub App installation as reported by {@code GET /app/installations/{id}}.
 *
 * @param id          installation id
 * @param account     the organization or user account the app is installed on
 * @param accountType {@code Organization} or {@code User}
 */
public record GitHubInstallation(
        long id,
        ProviderResource account,
        String accountType) {
}
