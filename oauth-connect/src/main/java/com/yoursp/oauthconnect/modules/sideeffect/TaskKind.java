package com.yoursp.oauthconnect.modules.sideeffect;

import com.yoursp.oauthconnect.modules.provider.Provider;

/**
 * Background tasks queued after a provider is connected.
 * The queue name is what the worker listens on.
 */
public enum TaskKind {

    GITHUB_MEMBER_SYNC("github_member_sync"),
    JIRA_USER_SYNC("jira_user_sync"),
    SLACK_USER_SYNC("slack_user_sync");

    private final String queueName;

    TaskKind(String queueName) {
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }

    /** The membership sync task for a newly connected provider. */
    public static TaskKind memberSyncFor(Provider provider) {
        return switch (provider) {
            case GITHUB -> GITHUB_MEMBER_SYNC;
            case JIRA -> JIRA_USER_SYNC;
            case SLACK -> SLACK_USER_SYNC;
        };
    }
}
