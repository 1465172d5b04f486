package com.yoursp.oauthconnect.modules.auth;

import com.yoursp.oauthconnect.model.entity.User;
import com.yoursp.oauthconnect.model.entity.UserSession;
import com.yoursp.oauthconnect.repository.UserRepository;
import com.yoursp.oauthconnect.repository.UserSessionRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Session authentication filter.
 * <ul>
 * <li>Reads the {@code OAUTH_CONNECT_SESSION} cookie and resolves the session</li>
 * <li>Exposes the user as {@value #CURRENT_USER_ATTRIBUTE} and the session id
 * as {@value #SESSION_HANDLE_ATTRIBUTE}</li>
 * <li>Under {@code /auth/} a missing or invalid session is not an error: the
 * callback decides per flow whether a caller is required</li>
 * <li>Everywhere else returns 401 JSON</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthFilter extends OncePerRequestFilter {

    public static final String SESSION_COOKIE_NAME = "OAUTH_CONNECT_SESSION";
    public static final String CURRENT_USER_ATTRIBUTE = "currentUser";
    public static final String SESSION_HANDLE_ATTRIBUTE = "sessionHandle";

    private static final String OPTIONAL_SESSION_PREFIX = "/auth/";

    private final UserSessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        boolean sessionOptional = request.getRequestURI().startsWith(OPTIONAL_SESSION_PREFIX);
        String sessionToken = extractSessionCookie(request);

        if (sessionToken == null) {
            if (sessionOptional) {
                filterChain.doFilter(request, response);
            } else {
                sendUnauthorized(response, "No session cookie");
            }
            return;
        }

        Optional<UserSession> sessionOpt = sessionRepository.findBySessionToken(sessionToken);
        Optional<User> userOpt = sessionOpt
                .filter(this::notExpired)
                .flatMap(session -> userRepository.findById(session.getUserId()));

        if (userOpt.isEmpty()) {
            if (sessionOptional) {
                log.debug("Ignoring invalid session on {}", request.getRequestURI());
                filterChain.doFilter(request, response);
            } else {
                sendUnauthorized(response, "Invalid session");
            }
            return;
        }

        UserSession session = sessionOpt.get();
        User user = userOpt.get();
        sessionRepository.updateLastActive(session.getId());

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                user.getId().toString(),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_USER")));
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(CURRENT_USER_ATTRIBUTE, user);
        request.setAttribute(SESSION_HANDLE_ATTRIBUTE, session.getId().toString());

        filterChain.doFilter(request, response);
    }

    private boolean notExpired(UserSession session) {
        boolean expired = session.getExpiresAt() != null && session.getExpiresAt().isBefore(OffsetDateTime.now(clock));
        if (expired) {
            log.debug("Session expired for user {}", session.getUserId());
        }
        return !expired;
    }

    private String extractSessionCookie(HttpServletRequest request) {
        if (request.getCookies() == null)
            return null;
        return Arrays.stream(request.getCookies())
                .filter(c -> SESSION_COOKIE_NAME.equals(c.getName()))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);
    }

    private void sendUnauthorized(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"" + message + "\"}");
    }
}
