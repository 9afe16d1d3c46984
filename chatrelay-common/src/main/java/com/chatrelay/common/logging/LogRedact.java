package com.chatrelay.common.logging;

import java.util.regex.Pattern;

/**
 * Keeps secrets and long user text out of log output.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;
    private static final int DEFAULT_PREVIEW_CHARS = 80;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Mask a token, keeping a short prefix and suffix when long enough.
     */
    public static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    /**
     * Single-line, bounded preview of message text.
     */
    public static String preview(String text) {
        return preview(text, DEFAULT_PREVIEW_CHARS);
    }

    public static String preview(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String flat = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (flat.length() <= maxChars) {
            return flat;
        }
        return flat.substring(0, Math.max(0, maxChars)) + "…(" + flat.length() + " chars)";
    }
}
