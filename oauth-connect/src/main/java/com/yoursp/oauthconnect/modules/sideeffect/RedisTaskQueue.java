package com.yoursp.oauthconnect.modules.sideeffect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Pushes a JSON envelope {@code {id, kind, payload, enqueuedAt}} onto the
 * Redis list {@code tasks:{queueName}}. A worker pops from the other end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisTaskQueue implements TaskQueue {

    static final String QUEUE_KEY_PREFIX = "tasks:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public AsyncTaskHandle push(TaskKind kind, Map<String, Object> payload) {
        String taskId = UUID.randomUUID().toString();

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("id", taskId);
        envelope.put("kind", kind.queueName());
        envelope.put("payload", payload);
        envelope.put("enqueuedAt", clock.instant().toString());

        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task payload is not serializable", e);
        }

        redisTemplate.opsForList().leftPush(QUEUE_KEY_PREFIX + kind.queueName(), json);
        log.debug("Queued task {} on {}", taskId, kind.queueName());
        return new AsyncTaskHandle(taskId, kind);
    }
}
