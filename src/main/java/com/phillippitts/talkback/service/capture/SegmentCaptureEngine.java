package com.phillippitts.talkback.service.capture;

import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.EnvironmentProfile;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.domain.TranscriptFragment;
import com.phillippitts.talkback.domain.UtteranceBuffer;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.assembly.UtteranceAssembler;
import com.phillippitts.talkback.service.audio.AudioLevels;
import com.phillippitts.talkback.service.audio.source.AudioFrameSource;
import com.phillippitts.talkback.service.audio.source.AudioFrameStream;
import com.phillippitts.talkback.service.filter.SelfSpeechFilter;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.profile.EnvironmentProfileResolver;
import com.phillippitts.talkback.service.state.InteractionState;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Chunk-by-chunk capture loop that decides when a person has finished speaking.
 *
 * <p><b>Per chunk:</b>
 * <ol>
 *   <li>Abort with null if the assistant is speaking.</li>
 *   <li>Read one chunk of {@code baseChunk(mode) x chunkDurationMultiplier}.</li>
 *   <li>Classify it through {@link ChunkClassifier}: silence, self-speech and recognizer
 *       failures all add to the silence counter; human speech is retained and resets it.</li>
 *   <li>Once speech has been heard and silence reaches
 *       {@code silenceThreshold x silenceToleranceMultiplier}, finalize, unless the last
 *       fragment ends with an incomplete-sentence opener, which buys one more silence period
 *       for that fragment.</li>
 * </ol>
 *
 * <p>Elapsed time and silence are measured in captured audio, not wall-clock time.
 * Recognizer failures never escape; only {@link AudioSourceUnavailableException} does.
 *
 * <p>Each call runs under a Log4j2 thread context carrying {@code listenId} and {@code mode}.
 */
@Component
public class SegmentCaptureEngine {

    private static final Logger LOG = LogManager.getLogger(SegmentCaptureEngine.class);

    /** Gate headroom over the ambient level measured during calibration. */
    static final double AMBIENT_HEADROOM = 1.5;

    private final AudioFrameSource source;
    private final EnvironmentProfileResolver profiles;
    private final ChunkClassifier classifier;
    private final SelfSpeechFilter filter;
    private final UtteranceAssembler assembler;
    private final IncompleteUtteranceDetector incomplete;
    private final InteractionState state;
    private final ListenProperties props;
    private final VoiceMetrics metrics;

    public SegmentCaptureEngine(AudioFrameSource source,
                                EnvironmentProfileResolver profiles,
                                ChunkClassifier classifier,
                                SelfSpeechFilter filter,
                                UtteranceAssembler assembler,
                                IncompleteUtteranceDetector incomplete,
                                InteractionState state,
                                ListenProperties props,
                                VoiceMetrics metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.incomplete = Objects.requireNonNull(incomplete, "incomplete");
        this.state = Objects.requireNonNull(state, "state");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Listens for one human utterance.
     *
     * @param timeout          how long to wait for speech to start
     * @param silenceThreshold silence that ends an utterance, before the profile's tolerance multiplier
     * @param maxTotalTime     hard cap on captured audio for this call
     * @param mode             capture mode
     * @return the assembled transcript, or null when nothing usable was heard
     * @throws AudioSourceUnavailableException if the microphone cannot be opened or fails
     */
    public String listen(Duration timeout, Duration silenceThreshold, Duration maxTotalTime, ListenMode mode) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(silenceThreshold, "silenceThreshold");
        Objects.requireNonNull(maxTotalTime, "maxTotalTime");
        Objects.requireNonNull(mode, "mode");
        if (maxTotalTime.isNegative() || maxTotalTime.isZero()) {
            throw new IllegalArgumentException("maxTotalTime must be positive");
        }

        String listenId = UUID.randomUUID().toString().substring(0, 8);
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext
                .put("listenId", listenId)
                .put("mode", mode.name())) {
            String result = doListen(timeout, silenceThreshold, maxTotalTime, mode);
            LOG.info("Listen finished: {}", result == null ? "no utterance" : LogSanitizer.describe(result));
            return result;
        }
    }

    private String doListen(Duration timeout, Duration silenceThreshold, Duration maxTotalTime, ListenMode mode) {
        String modeTag = mode.name().toLowerCase(Locale.ROOT);
        if (state.isSpeaking()) {
            LOG.debug("Assistant is speaking; not listening");
            metrics.incrementListenOutcome(modeTag, "speaking");
            return null;
        }

        EnvironmentProfile profile = profiles.probe();
        Duration chunk = profile.scaleChunk(props.chunkDurationFor(mode));
        if (chunk.isNegative() || chunk.isZero()) {
            throw new IllegalStateException("Chunk duration for " + mode + " must be positive: " + chunk);
        }
        Duration requiredSilence = profile.scaleSilence(silenceThreshold);
        String chunkHint = assembler.hintsFor(mode).get(0);

        UtteranceBuffer buffer = new UtteranceBuffer();
        try (AudioFrameStream stream = source.open()) {
            int gate = energyGate(stream, profile, mode);
            LOG.debug("Capture parameters: chunk={}ms, silence={}ms, gate={}, timeout={}ms, max={}ms",
                    chunk.toMillis(), requiredSilence.toMillis(), gate, timeout.toMillis(), maxTotalTime.toMillis());

            Duration elapsed = Duration.ZERO;
            Duration silence = Duration.ZERO;
            boolean humanSpeechDetected = false;
            int graceGrantedAt = -1;

            while (elapsed.compareTo(maxTotalTime) < 0) {
                if (state.isSpeaking()) {
                    LOG.info("Assistant started speaking; abandoning capture");
                    metrics.incrementListenOutcome(modeTag, "speaking");
                    return null;
                }
                if (!humanSpeechDetected && elapsed.compareTo(timeout) >= 0) {
                    LOG.debug("No speech within {}ms", timeout.toMillis());
                    metrics.incrementListenOutcome(modeTag, "no-speech");
                    return null;
                }

                AudioSegment segment = stream.read(chunk);
                Duration offset = elapsed;
                Duration captured = segment.duration().isZero() ? chunk : segment.duration();
                elapsed = elapsed.plus(captured);

                ChunkOutcome outcome = classifier.classify(segment, gate, chunkHint, mode);
                if (outcome.isHuman()) {
                    if (state.isSpeaking()) {
                        // playback began while this chunk was being transcribed
                        metrics.incrementListenOutcome(modeTag, "speaking");
                        return null;
                    }
                    buffer.append(new TranscriptFragment(outcome.text(), segment, offset));
                    silence = Duration.ZERO;
                    humanSpeechDetected = true;
                } else {
                    silence = silence.plus(captured);
                }

                if (humanSpeechDetected && silence.compareTo(requiredSilence) >= 0) {
                    String last = buffer.lastFragment().map(TranscriptFragment::text).orElse("");
                    boolean withinGrace = silence.compareTo(requiredSilence.multipliedBy(2)) < 0;
                    if (graceGrantedAt != buffer.size() && withinGrace && incomplete.endsWithOpener(last)) {
                        LOG.debug("Fragment ends with an incomplete opener; waiting for the rest");
                        graceGrantedAt = buffer.size();
                        silence = Duration.ZERO;
                        continue;
                    }
                    LOG.debug("Speaker finished after {}ms of silence ({} chunk(s) retained)",
                            silence.toMillis(), buffer.size());
                    break;
                }
            }
        }

        return finish(buffer, mode, modeTag);
    }

    private String finish(UtteranceBuffer buffer, ListenMode mode, String modeTag) {
        buffer.freeze();
        if (buffer.isEmpty()) {
            metrics.incrementListenOutcome(modeTag, "no-speech");
            return null;
        }
        String text = assembler.assemble(buffer.consume(), mode);
        if (text == null) {
            metrics.incrementListenOutcome(modeTag, "unrecognized");
            return null;
        }
        if (filter.matchesCatalog(text)) {
            LOG.info("Assembled utterance rejected as self-speech");
            metrics.incrementListenOutcome(modeTag, "rejected");
            return null;
        }
        metrics.incrementListenOutcome(modeTag, "utterance");
        return text;
    }

    private int energyGate(AudioFrameStream stream, EnvironmentProfile profile, ListenMode mode) {
        int gate = profile.effectiveThreshold(mode);
        if (!props.isCalibrate() || profile.calibrationDuration().isZero()) {
            return gate;
        }
        AudioSegment ambient = stream.read(profile.calibrationDuration());
        int ambientGate = (int) Math.round(AudioLevels.rms(ambient) * AMBIENT_HEADROOM);
        if (ambientGate > gate) {
            LOG.debug("Ambient noise raised energy gate from {} to {}", gate, ambientGate);
            return ambientGate;
        }
        return gate;
    }
}
