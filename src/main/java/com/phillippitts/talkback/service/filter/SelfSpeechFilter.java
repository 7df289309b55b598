package com.phillippitts.talkback.service.filter;

import com.phillippitts.talkback.config.properties.FilterProperties;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.state.InteractionState;
import com.phillippitts.talkback.service.state.PlaybackSnapshot;
import com.phillippitts.talkback.service.stt.TokenizerUtil;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Heuristic classifier that decides whether a transcribed fragment is the assistant's own
 * output picked up by the microphone.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>the fragment contains a catalog phrase</li>
 *   <li>the fragment's words mostly occur in the text currently being played back</li>
 *   <li>the fragment is longer than {@code filter.max-human-words} words</li>
 * </ol>
 *
 * <p>Stateless apart from the read of {@link InteractionState}; thread-safe.
 */
@Component
public class SelfSpeechFilter {

    private static final Logger LOG = LogManager.getLogger(SelfSpeechFilter.class);

    /** Outcome of {@link #classify(String)}. */
    public enum Verdict {
        HUMAN, CATALOG, PLAYBACK_ECHO, TOO_LONG;

        public boolean isSelfSpeech() {
            return this != HUMAN;
        }
    }

    private final SelfSpeechCatalog catalog;
    private final FilterProperties props;
    private final InteractionState state;
    private final VoiceMetrics metrics;

    public SelfSpeechFilter(SelfSpeechCatalog catalog, FilterProperties props, InteractionState state,
                            VoiceMetrics metrics) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.props = Objects.requireNonNull(props, "props");
        this.state = Objects.requireNonNull(state, "state");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Returns true if {@code text} is probably the assistant's own speech.
     *
     * @param text transcribed fragment; null or blank is never self-speech
     * @return classification result
     */
    public boolean isSelfSpeech(String text) {
        return classify(text).isSelfSpeech();
    }

    /**
     * Catalog rule alone. Used on assembled utterances, whose length is not bounded by the
     * per-fragment word limit.
     */
    public boolean matchesCatalog(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String phrase = catalog.firstMatch(text);
        if (phrase == null) {
            return false;
        }
        suppressed(Verdict.CATALOG, text, phrase);
        return true;
    }

    public Verdict classify(String text) {
        if (text == null || text.isBlank()) {
            return Verdict.HUMAN;
        }

        String phrase = catalog.firstMatch(text);
        if (phrase != null) {
            return suppressed(Verdict.CATALOG, text, phrase);
        }

        List<String> tokens = TokenizerUtil.tokenize(text);
        if (echoesPlayback(tokens)) {
            return suppressed(Verdict.PLAYBACK_ECHO, text, "playback text");
        }

        if (tokens.size() > props.getMaxHumanWords()) {
            return suppressed(Verdict.TOO_LONG, text, tokens.size() + " words");
        }
        return Verdict.HUMAN;
    }

    private boolean echoesPlayback(List<String> tokens) {
        if (tokens.size() < props.getEchoMinTokens()) {
            return false;
        }
        PlaybackSnapshot playback = state.playbackSnapshot();
        // only while speaking; once playback ends, overlapping words are a reply
        if (!playback.speaking() || playback.text() == null) {
            return false;
        }
        double ratio = TokenizerUtil.containmentRatio(tokens, TokenizerUtil.tokenize(playback.text()));
        return ratio >= props.getEchoOverlapThreshold();
    }

    private Verdict suppressed(Verdict verdict, String text, String reason) {
        metrics.incrementSelfSpeech(verdict.name().toLowerCase(Locale.ROOT));
        LOG.debug("Suppressed self-speech ({}: {}): '{}'", verdict, reason, LogSanitizer.truncate(text, 40));
        return verdict;
    }
}
