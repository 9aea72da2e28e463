package com.phillippitts.octvol.util;

/** Utility for privacy-safe logging of patient and exam identifiers. */
public final class LogSanitizer {

    private static final int VISIBLE_PREFIX = 2;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks an identifier for logs: keeps the first two characters and replaces the rest with '*'.
     * Returns "" for null or blank input.
     */
    public static String maskIdentifier(String id) {
        if (id == null || id.isBlank()) {
            return "";
        }
        if (id.length() <= VISIBLE_PREFIX) {
            return "*".repeat(id.length());
        }
        return truncate(id, VISIBLE_PREFIX) + "*".repeat(id.length() - VISIBLE_PREFIX);
    }
}
