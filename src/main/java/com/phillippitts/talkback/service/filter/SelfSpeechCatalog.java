package com.phillippitts.talkback.service.filter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Versioned list of phrases the assistant is known to say.
 *
 * @param version catalog version from the {@code # version:} header, "unversioned" when absent
 * @param phrases lower-cased phrases, in file order
 */
public record SelfSpeechCatalog(String version, List<String> phrases) {

    public SelfSpeechCatalog {
        Objects.requireNonNull(version, "version");
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
    }

    /**
     * Returns the first catalog phrase contained in {@code text}, ignoring case.
     *
     * @param text fragment to test
     * @return matching phrase or null
     */
    public String firstMatch(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (lower.contains(phrase)) {
                return phrase;
            }
        }
        return null;
    }
}
