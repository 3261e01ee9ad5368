package com.phillippitts.lifecycle.util;

/** Keeps error messages and metadata previews short enough for single-line logs. */
public final class LogSanitizer {

    public static final int DEFAULT_MAX = 200;
    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncates to {@link #DEFAULT_MAX} characters and flattens line breaks.
     */
    public static String truncate(String s) {
        return truncate(s, DEFAULT_MAX);
    }

    /**
     * Truncates the input to at most {@code max} characters, marking the cut with "...".
     * Line breaks become spaces. Returns "" for null input or a non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        if (max <= ELLIPSIS.length()) {
            return flat.substring(0, max);
        }
        return flat.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
