package com.phillippitts.voicestream.util;

/** Utility for privacy-safe logging of request text. */
public final class LogSanitizer {

    /** Default number of characters of request text that may reach the logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 32;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of request text: line breaks flattened, truncated to
     * {@link #DEFAULT_PREVIEW_CHARS} with a trailing ellipsis and the original length.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "... (" + flat.length() + " chars)";
    }
}
