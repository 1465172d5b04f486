package com.yoursp.oauthconnect.modules.auth;

import com.yoursp.oauthconnect.model.entity.UserSession;
import com.yoursp.oauthconnect.repository.UserSessionRepository;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.UUID;

/**
 * Creates server-side sessions and writes the session cookie.
 * <p>
 * The cookie is SameSite=Lax: the provider's redirect back to
 * {@code /auth/{provider}/callback} is a top-level cross-site GET and must
 * carry the session.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    static final Duration SESSION_MAX_AGE = Duration.ofHours(8);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserSessionRepository sessionRepository;
    private final Clock clock;

    /**
     * @return the new session token (cookie value)
     */
    public String createSession(UUID userId, String ipAddress, String userAgent) {
        String sessionToken = generateSessionToken();
        sessionRepository.save(UserSession.builder()
                .userId(userId)
                .sessionToken(sessionToken)
                .expiresAt(OffsetDateTime.now(clock).plus(SESSION_MAX_AGE))
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .build());
        log.info("Created session for user {}", userId);
        return sessionToken;
    }

    public void writeCookie(HttpServletResponse response, String sessionToken) {
        ResponseCookie cookie = ResponseCookie.from(SessionAuthFilter.SESSION_COOKIE_NAME, sessionToken)
                .httpOnly(true)
                .secure(true)
                .path("/")
                .maxAge(SESSION_MAX_AGE)
                .sameSite("Lax")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    /** Deletes the session behind the cookie value, if any. */
    public void invalidate(String sessionToken) {
        if (sessionToken == null) {
            return;
        }
        sessionRepository.findBySessionToken(sessionToken).ifPresent(session -> {
            sessionRepository.delete(session);
            log.info("Logged out user {}", session.getUserId());
        });
    }

    public void clearCookie(HttpServletResponse response) {
        ResponseCookie cookie = ResponseCookie.from(SessionAuthFilter.SESSION_COOKIE_NAME, "")
                .httpOnly(true)
                .secure(true)
                .path("/")
                .maxAge(0)
                .sameSite("Lax")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private String generateSessionToken() {
        byte[] bytes = new byte[64];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
