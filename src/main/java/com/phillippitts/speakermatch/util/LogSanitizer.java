package com.phillippitts.speakermatch.util;

/** Utility for privacy-safe logging of user text and model replies. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     * Never splits a surrogate pair, so the result may be one char shorter than max.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, cutPoint(s, max));
    }

    /**
     * Single-line preview: collapses whitespace runs to one space and appends "..." when cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        return flat.length() <= max ? flat : flat.substring(0, cutPoint(flat, max)) + ELLIPSIS;
    }

    private static int cutPoint(String s, int max) {
        return Character.isHighSurrogate(s.charAt(max - 1)) ? max - 1 : max;
    }
}
