package com.yoursp.oauthconnect.modules.sideeffect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Best-effort enqueue of follow-up work.
 * <p>
 * Callers commit their durable writes first. A queue failure is logged at WARN
 * and reported as an empty result; it never propagates and never rolls
 * anything back, so an outage only delays the background task.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SideEffectDispatcher {

    private final TaskQueue taskQueue;

    /**
     * @param kind    task to queue
     * @param payload task arguments, must be JSON-serializable
     * @return the task handle, or empty if the queue rejected it
     */
    public Optional<AsyncTaskHandle> enqueue(TaskKind kind, Map<String, Object> payload) {
        try {
            AsyncTaskHandle handle = taskQueue.push(kind, payload);
            log.info("Queued {} (task={})", kind, handle.taskId());
            return Optional.of(handle);
        } catch (RuntimeException e) {
            log.warn("Failed to queue {} with payload {}: {}", kind, payload, e.getMessage());
            return Optional.empty();
        }
    }
}
