package com.yoursp.oauthconnect.modules.sideeffect;

/**
 * Opaque reference to a queued task. Nothing waits on it.
 */
public record AsyncTaskHandle(String taskId, TaskKind kind) {
}
