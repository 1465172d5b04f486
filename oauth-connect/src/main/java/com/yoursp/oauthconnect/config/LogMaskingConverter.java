package com.yoursp.oauthconnect.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks credentials in log messages.
 * <ul>
 * <li>Bearer / access_token / refresh_token values: first 8 chars + "..."</li>
 * <li>client_secret: "[REDACTED]"</li>
 * <li>Authorization codes ({@code code=}): "[REDACTED]"</li>
 * <li>State tokens ({@code state=}): first 8 chars + "..."</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.oauthconnect.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches access_token / refresh_token as query param, form field or JSON key
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("((?:access|refresh)_token[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches client_secret=<value> or "client_secret":"<value>"
    private static final Pattern CLIENT_SECRET_PATTERN = Pattern.compile("(client_secret[\"=:]+\\s*[\"']?)[^\"&\\s,]+");

    // Matches an authorization code query parameter
    private static final Pattern CODE_PATTERN = Pattern.compile("([?&\\s]code=)[^&\\s]+");

    // Matches the state query parameter (payload.signature)
    private static final Pattern STATE_PATTERN = Pattern.compile("([?&\\s]state=)([A-Za-z0-9_\\-.%]{8})[A-Za-z0-9_\\-.%]+");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = CLIENT_SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = CODE_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = STATE_PATTERN.matcher(masked).replaceAll("$1$2...");

        return masked;
    }
}
