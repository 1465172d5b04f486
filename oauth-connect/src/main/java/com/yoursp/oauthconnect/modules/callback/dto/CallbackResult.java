package com.yoursp.oauthconnect.modules.callback.dto;

import java.util.List;

/**
 * Outcome of a callback: always a redirect, optionally with flash messages
 * and a freshly created session.
 *
 * @param redirectTo   relative path to redirect to
 * @param messages     messages for the next page
 * @param sessionToken new session cookie value, set only by the login flow
 */
public record CallbackResult(
        String redirectTo,
        List<FlashMessage> messages,
        String sessionToken) {

    public static CallbackResult redirect(String redirectTo) {
        return new CallbackResult(redirectTo, List.of(), null);
    }

    public static CallbackResult error(String redirectTo, String message) {
        return new CallbackResult(redirectTo, List.of(FlashMessage.error(message)), null);
    }

    public static CallbackResult success(String redirectTo, String message) {
        return new CallbackResult(redirectTo, List.of(FlashMessage.success(message)), null);
    }

    public static CallbackResult info(String redirectTo, String message) {
        return new CallbackResult(redirectTo, List.of(FlashMessage.info(message)), null);
    }

    public CallbackResult withSession(String token) {
        return new CallbackResult(redirectTo, messages, token);
    }

    public boolean isError() {
        return messages.stream().anyMatch(m -> m.level() == FlashMessage.Level.ERROR);
    }
}
