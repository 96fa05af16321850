package com.phillippitts.slawatch.util;

/** Utility for privacy-safe logging of response bodies and credentials. */
public final class LogSanitizer {
    private static final int VISIBLE_SECRET_CHARS = 4;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, marking the cut with "..."; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Masks a credential for logs, keeping only its first few characters; returns "<unset>" for
     * null or blank input.
     */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            return "<unset>";
        }
        if (secret.length() <= VISIBLE_SECRET_CHARS) {
            return "****";
        }
        return secret.substring(0, VISIBLE_SECRET_CHARS) + "****";
    }
}
