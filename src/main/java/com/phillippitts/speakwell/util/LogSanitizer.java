package com.phillippitts.speakwell.util;

/** Utility for privacy-safe logging of sentence and transcript previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    private static final String ELLIPSIS = "...";

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
     * Like {@link #truncate(String, int)} but marks cut text with a trailing "..." and
     * collapses line breaks so a preview stays on one log line.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("[\\r\\n]+", " ");
        if (flat.length() <= max || max <= 0) {
            return truncate(flat, max);
        }
        return truncate(flat, max) + ELLIPSIS;
    }
}
