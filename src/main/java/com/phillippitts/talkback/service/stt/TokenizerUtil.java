package com.phillippitts.talkback.service.stt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing transcribed text into normalized word tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on anything that is not a letter, digit or apostrophe</li>
 *   <li>Convert all tokens to lowercase</li>
 *   <li>Filter out blank tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>Apostrophes are kept so "that's" and "i'm" stay single words.
 */
public final class TokenizerUtil {

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized word tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase tokens (empty if no valid tokens)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            String trimmed = trimApostrophes(part);
            if (!trimmed.isBlank()) {
                tokens.add(trimmed);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Share of {@code fragment}'s distinct tokens that also occur in {@code reference}.
     *
     * @param fragment  tokens being classified
     * @param reference tokens to compare against
     * @return ratio in [0,1]; 0 when {@code fragment} is empty
     */
    public static double containmentRatio(List<String> fragment, List<String> reference) {
        Set<String> a = new HashSet<>(fragment);
        if (a.isEmpty()) {
            return 0.0;
        }
        Set<String> b = new HashSet<>(reference);
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return (double) shared / a.size();
    }

    /**
     * Checks whether {@code phrase} occurs in {@code text} as a whole-word sequence.
     *
     * @param text   text to search
     * @param phrase phrase to find
     * @return true if every token of the phrase appears consecutively in the text
     */
    public static boolean containsPhrase(String text, String phrase) {
        List<String> haystack = tokenize(text);
        List<String> needle = tokenize(phrase);
        if (needle.isEmpty() || needle.size() > haystack.size()) {
            return false;
        }
        return Collections.indexOfSubList(haystack, needle) >= 0;
    }

    private static String trimApostrophes(String part) {
        int start = 0;
        int end = part.length();
        while (start < end && part.charAt(start) == '\'') {
            start++;
        }
        while (end > start && part.charAt(end - 1) == '\'') {
            end--;
        }
        return part.substring(start, end);
    }
}
