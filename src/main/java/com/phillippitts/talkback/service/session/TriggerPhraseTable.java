package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.service.stt.TokenizerUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identity to trigger-phrase table, canonical phrases plus common mishearings.
 *
 * <p>Phrases match on word boundaries, so "mily" does not fire inside "family". When several
 * identities match, the one listed first wins.
 */
public final class TriggerPhraseTable {

    private final Map<String, List<String>> phrases;

    public TriggerPhraseTable(Map<String, List<String>> phrases) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        phrases.forEach((identity, list) -> copy.put(identity, List.copyOf(list)));
        this.phrases = copy;
    }

    /**
     * Finds the identity whose trigger phrase occurs in {@code text}.
     *
     * @param text utterance
     * @return matching identity, or empty
     */
    public Optional<String> match(String text) {
        for (Map.Entry<String, List<String>> entry : phrases.entrySet()) {
            for (String phrase : entry.getValue()) {
                if (TokenizerUtil.containsPhrase(text, phrase)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }
}
