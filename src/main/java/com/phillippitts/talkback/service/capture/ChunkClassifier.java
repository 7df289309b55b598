package com.phillippitts.talkback.service.capture;

import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException;
import com.phillippitts.talkback.service.audio.AudioLevels;
import com.phillippitts.talkback.service.filter.SelfSpeechFilter;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.stt.SpeechRecognizer;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Energy gate, recognizer call and self-speech check for a single chunk.
 *
 * <p>Shared by the capture loop and the interrupt monitor. Recognizer failures become
 * {@link ChunkOutcome.Kind#ERROR}; nothing is thrown for them.
 */
@Component
public class ChunkClassifier {

    private static final Logger LOG = LogManager.getLogger(ChunkClassifier.class);

    private final SpeechRecognizer recognizer;
    private final SelfSpeechFilter filter;
    private final VoiceMetrics metrics;

    public ChunkClassifier(SpeechRecognizer recognizer, SelfSpeechFilter filter, VoiceMetrics metrics) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Classifies one chunk.
     *
     * @param segment      captured audio
     * @param energyGate   RMS level below which the chunk is silence
     * @param languageHint hint passed to the recognizer
     * @param mode         capture mode, for metrics
     * @return outcome; never null
     */
    public ChunkOutcome classify(AudioSegment segment, int energyGate, String languageHint, ListenMode mode) {
        if (segment.isEmpty() || AudioLevels.rms(segment) < energyGate) {
            metrics.incrementEnergyGated(mode.name().toLowerCase(Locale.ROOT));
            return ChunkOutcome.of(ChunkOutcome.Kind.GATED);
        }

        TranscriptionResult result;
        try {
            result = recognizer.transcribe(segment, languageHint);
        } catch (TranscriptionServiceUnavailableException e) {
            LOG.debug("Recognizer unavailable for chunk: {}", e.getMessage());
            return ChunkOutcome.of(ChunkOutcome.Kind.ERROR);
        }
        if (result.isEmpty()) {
            return ChunkOutcome.of(ChunkOutcome.Kind.EMPTY);
        }

        String text = result.text().trim();
        if (filter.isSelfSpeech(text)) {
            return ChunkOutcome.of(ChunkOutcome.Kind.SELF_SPEECH);
        }
        LOG.debug("Human speech in chunk: '{}'", LogSanitizer.truncate(text, 40));
        return ChunkOutcome.human(text);
    }
}
