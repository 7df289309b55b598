package com.phillippitts.talkback.service.capture;

import com.phillippitts.talkback.service.stt.TokenizerUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes fragments that end with the opening words of a question, such as
 * "how far is", so the capture loop can wait for the rest of the sentence.
 */
public final class IncompleteUtteranceDetector {

    private final List<List<String>> openers;

    /**
     * @param openers opener phrases for the active locale
     */
    public IncompleteUtteranceDetector(List<String> openers) {
        List<List<String>> tokenized = new ArrayList<>();
        for (String opener : openers) {
            List<String> tokens = TokenizerUtil.tokenize(opener);
            if (!tokens.isEmpty()) {
                tokenized.add(tokens);
            }
        }
        this.openers = List.copyOf(tokenized);
    }

    /**
     * Returns true if the fragment's last words are one of the openers.
     *
     * @param text latest retained fragment
     * @return whether the speaker probably has more to say
     */
    public boolean endsWithOpener(String text) {
        List<String> tokens = TokenizerUtil.tokenize(text);
        for (List<String> opener : openers) {
            int size = opener.size();
            if (tokens.size() >= size && tokens.subList(tokens.size() - size, tokens.size()).equals(opener)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return openers.size();
    }
}
