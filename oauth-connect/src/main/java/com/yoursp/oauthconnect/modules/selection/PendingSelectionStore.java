package com.yoursp.oauthconnect.modules.selection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.oauthconnect.modules.provider.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed slot for {@link PendingSelection}s.
 * <ul>
 * <li>Key: {@code pending_selection:{provider}:{sessionHandle}}</li>
 * <li>TTL: 600s, matching the state token lifetime</li>
 * <li>{@link #consume} is GETDEL, so a selection completes at most once</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingSelectionStore {

    static final String KEY_PREFIX = "pending_selection:";
    static final long TTL_SECONDS = 600;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public void save(String sessionHandle, PendingSelection selection) {
        requireHandle(sessionHandle);
        try {
            redisTemplate.opsForValue().set(
                    key(selection.provider(), sessionHandle),
                    objectMapper.writeValueAsString(selection),
                    TTL_SECONDS,
                    TimeUnit.SECONDS);
            log.debug("Stashed {} {} candidates for selection", selection.candidates().size(), selection.provider());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pending selection", e);
        }
    }

    public Optional<PendingSelection> find(String sessionHandle, Provider provider) {
        requireHandle(sessionHandle);
        return parse(redisTemplate.opsForValue().get(key(provider, sessionHandle)));
    }

    public Optional<PendingSelection> consume(String sessionHandle, Provider provider) {
        requireHandle(sessionHandle);
        return parse(redisTemplate.opsForValue().getAndDelete(key(provider, sessionHandle)));
    }

    private Optional<PendingSelection> parse(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PendingSelection.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable pending selection: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static void requireHandle(String sessionHandle) {
        if (sessionHandle == null || sessionHandle.isBlank()) {
            throw new IllegalArgumentException("A session handle is required for pending selections");
        }
    }

    private static String key(Provider provider, String sessionHandle) {
        return KEY_PREFIX + provider.slug() + ":" + sessionHandle;
    }
}
