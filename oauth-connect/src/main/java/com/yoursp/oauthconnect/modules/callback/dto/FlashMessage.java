package com.yoursp.oauthconnect.modules.callback.dto;

/**
 * Transient, human-readable outcome shown once after a redirect.
 */
public record FlashMessage(Level level, String text) {

    public enum Level {
        SUCCESS,
        INFO,
        ERROR
    }

    public static FlashMessage success(String text) {
        return new FlashMessage(Level.SUCCESS, text);
    }

    public static FlashMessage info(String text) {
        return new FlashMessage(Level.INFO, text);
    }

    public static FlashMessage error(String text) {
        return new FlashMessage(Level.ERROR, text);
    }
}
