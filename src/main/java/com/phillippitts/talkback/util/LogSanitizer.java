package com.phillippitts.talkback.util;

/** Utility for privacy-safe logging of transcribed text. */
public final class LogSanitizer {

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Describes text by length only, for INFO-level logs that must not carry user speech.
     */
    public static String describe(String s) {
        return s == null ? "<null>" : "<" + s.length() + " chars>";
    }
}
