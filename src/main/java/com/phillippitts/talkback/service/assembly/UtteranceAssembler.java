package com.phillippitts.talkback.service.assembly;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException;
import com.phillippitts.talkback.service.audio.AudioLevels;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.stt.SpeechRecognizer;
import com.phillippitts.talkback.util.LogSanitizer;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the chunks retained for one utterance into a single transcript.
 *
 * <p><b>Strategies:</b>
 * <ol>
 *   <li>Primary: concatenate all audio and transcribe it as one clip, walking the mode's
 *       language hints in order; up to {@code assembler.max-attempts} attempts with a pause
 *       between them.</li>
 *   <li>Fallback, only when the primary strategy produced nothing: transcribe each chunk
 *       with the first hint and join the non-empty results.</li>
 * </ol>
 *
 * <p>Either result is lower-cased, repaired through {@link LexicalRepairTable} and has its
 * whitespace collapsed. Recognizer failures are absorbed; this class never throws for them.
 */
@Component
public class UtteranceAssembler {

    private static final Logger LOG = LogManager.getLogger(UtteranceAssembler.class);

    private final SpeechRecognizer recognizer;
    private final AssemblerProperties props;
    private final LexicalRepairTable repairs;
    private final VoiceMetrics metrics;

    public UtteranceAssembler(SpeechRecognizer recognizer, AssemblerProperties props,
                              LexicalRepairTable repairs, VoiceMetrics metrics) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.props = Objects.requireNonNull(props, "props");
        this.repairs = Objects.requireNonNull(repairs, "repairs");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Assembles segments captured in {@link ListenMode#NORMAL}.
     *
     * @see #assemble(List, ListenMode)
     */
    public String assemble(List<AudioSegment> segments) {
        return assemble(segments, ListenMode.NORMAL);
    }

    /**
     * Assembles retained segments into a transcript.
     *
     * @param segments retained segments in capture order
     * @param mode     capture mode, which selects the language hints
     * @return cleaned transcript, or null if neither strategy produced usable text
     */
    public String assemble(List<AudioSegment> segments, ListenMode mode) {
        List<AudioSegment> usable = nonEmpty(segments);
        if (usable.isEmpty()) {
            return null;
        }
        List<String> hints = hintsFor(mode);

        String primary = primary(usable, hints);
        if (primary != null) {
            String cleaned = repairs.apply(primary);
            if (!cleaned.isEmpty()) {
                metrics.incrementAssembly("primary");
                return cleaned;
            }
        }

        LOG.info("Primary assembly produced no text after {} attempt(s); transcribing {} chunk(s) individually",
                props.maxAttempts(), usable.size());
        String fallback = repairs.apply(perSegment(usable, hints.get(0)));
        if (!fallback.isEmpty()) {
            metrics.incrementAssembly("fallback");
            return fallback;
        }
        metrics.incrementAssembly("none");
        return null;
    }

    /**
     * Ordered language hints for a mode.
     *
     * @param mode capture mode
     * @return non-empty hint list
     */
    public List<String> hintsFor(ListenMode mode) {
        return mode == ListenMode.INTL_GAME ? props.intlHints() : props.defaultHints();
    }

    private String primary(List<AudioSegment> segments, List<String> hints) {
        AudioSegment combined;
        try {
            combined = AudioLevels.concat(segments);
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot concatenate retained chunks: {}", e.getMessage());
            return null;
        }
        for (int attempt = 1; attempt <= props.maxAttempts(); attempt++) {
            for (String hint : hints) {
                String text = tryTranscribe(combined, hint);
                if (text != null) {
                    LOG.debug("Assembled utterance (hint={}, attempt={}): '{}'",
                            hint, attempt, LogSanitizer.truncate(text, 40));
                    return text;
                }
            }
            if (attempt < props.maxAttempts()) {
                LOG.debug("Assembly attempt {} produced no text; retrying", attempt);
                if (!TimeUtils.sleepQuietly(props.retryPause())) {
                    return null;
                }
            }
        }
        return null;
    }

    private String perSegment(List<AudioSegment> segments, String hint) {
        List<String> parts = new ArrayList<>();
        for (AudioSegment segment : segments) {
            String text = tryTranscribe(segment, hint);
            if (text != null) {
                parts.add(text.trim());
            }
        }
        return String.join(" ", parts);
    }

    private String tryTranscribe(AudioSegment audio, String hint) {
        try {
            TranscriptionResult result = recognizer.transcribe(audio, hint);
            return result.isEmpty() ? null : result.text();
        } catch (TranscriptionServiceUnavailableException e) {
            LOG.debug("Recognizer unavailable during assembly (hint={}): {}", hint, e.getMessage());
            return null;
        }
    }

    private static List<AudioSegment> nonEmpty(List<AudioSegment> segments) {
        if (segments == null) {
            return List.of();
        }
        List<AudioSegment> usable = new ArrayList<>(segments.size());
        for (AudioSegment segment : segments) {
            if (segment != null && !segment.isEmpty()) {
                usable.add(segment);
            }
        }
        return usable;
    }
}
