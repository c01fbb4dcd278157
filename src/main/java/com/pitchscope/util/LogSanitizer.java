package com.pitchscope.util;

/** Utility for privacy-safe logging of transcript and payload previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Collapses line breaks and truncates to at most {@code max} characters, marking cut text
     * with an ellipsis. Returns "" for null input or a non-positive limit.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ").trim();
        if (flat.length() <= max) {
            return flat;
        }
        if (max <= ELLIPSIS.length()) {
            return flat.substring(0, max);
        }
        return flat.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
