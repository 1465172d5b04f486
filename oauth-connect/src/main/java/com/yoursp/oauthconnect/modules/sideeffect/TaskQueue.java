package com.yoursp.oauthconnect.modules.sideeffect;

import java.util.Map;

/**
 * Transport for background work. Implementations may throw on any
 * failure; {@link SideEffectDispatcher} is the only caller.
 */
public interface TaskQueue {

    AsyncTaskHandle push(TaskKind kind, Map<String, Object> payload);
}
