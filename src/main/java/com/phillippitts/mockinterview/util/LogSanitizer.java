package com.phillippitts.mockinterview.util;

/** Privacy-safe previews of candidate text for logs. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Keeps at most {@code max} characters, marks the cut and reports the original length.
     * Line breaks are flattened so one answer stays on one log line. Returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        return flat.substring(0, max) + "...(" + s.length() + " chars)";
    }

    /**
     * Describes text by size only, for contexts where no content may be logged at all.
     */
    public static String describe(String s) {
        if (s == null) {
            return "<null>";
        }
        return "<" + s.length() + " chars>";
    }
}
