package com.phillippitts.radflow.util;

/** Utility for privacy-safe logging of report and clipboard text. */
public final class LogSanitizer {

    /** Default preview length for report text in logs. */
    public static final int PREVIEW_CHARS = 40;

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
     * Single-line preview with newlines flattened, truncated to {@link #PREVIEW_CHARS}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        String cut = truncate(flat, PREVIEW_CHARS);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
