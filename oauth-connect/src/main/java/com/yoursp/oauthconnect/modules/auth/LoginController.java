package com.yoursp.oauthconnect.modules.auth;

import com.yoursp.oauthconnect.modules.connect.AuthorizeUrlBuilder;
import com.yoursp.oauthconnect.modules.provider.Provider;
import com.yoursp.oauthconnect.modules.state.FlowKind;
import com.yoursp.oauthconnect.modules.state.FlowRegistry;
import com.yoursp.oauthconnect.modules.state.StateTokenCodec;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Arrays;

/**
 * Sign in with GitHub and sign out.
 * <p>
 * /auth/github/login → GitHub authorize (minimal scope) → /auth/github/callback
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class LoginController {

    private final StateTokenCodec stateTokenCodec;
    private final AuthorizeUrlBuilder authorizeUrlBuilder;
    private final SessionService sessionService;

    @GetMapping("/github/login")
    public void login(HttpServletResponse response) throws IOException {
        String state = stateTokenCodec.encode(FlowKind.LOGIN, null);
        log.info("Redirecting to GitHub authorize for sign-in");
        response.sendRedirect(authorizeUrlBuilder.authorizeUrl(Provider.GITHUB, false, state));
    }

    @PostMapping("/logout")
    public void logout(HttpServletRequest request, HttpServletResponse response) throws IOException {
        sessionService.invalidate(sessionCookie(request));
        sessionService.clearCookie(response);
        response.sendRedirect(FlowRegistry.LOGIN_PATH);
    }

    private static String sessionCookie(HttpServletRequest request) {
        if (request.getCookies() == null)
            return null;
        return Arrays.stream(request.getCookies())
                .filter(c -> SessionAuthFilter.SESSION_COOKIE_NAME.equals(c.getName()))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);
    }
}
