package com.yoursp.oauthconnect.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.oauthconnect.modules.callback.dto.FlashMessage;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Hands redirect outcomes to the front end through a short-lived cookie
 * holding {@code base64url(JSON[{level, text}])}. The front end reads and
 * clears it on the next page load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlashMessageService {

    public static final String FLASH_COOKIE_NAME = "OAUTH_CONNECT_FLASH";
    private static final Duration FLASH_MAX_AGE = Duration.ofSeconds(60);

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, List<FlashMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        try {
            String value = Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(objectMapper.writeValueAsString(messages).getBytes(StandardCharsets.UTF_8));
            ResponseCookie cookie = ResponseCookie.from(FLASH_COOKIE_NAME, value)
                    .secure(true)
                    .path("/")
                    .maxAge(FLASH_MAX_AGE)
                    .sameSite("Lax")
                    .build();
            response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        } catch (JsonProcessingException e) {
            // the redirect still happens, only the message is lost
            log.error("Failed to serialize flash messages: {}", e.getMessage());
        }
    }
}
