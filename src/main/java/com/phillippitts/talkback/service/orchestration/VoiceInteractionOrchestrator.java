package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.audio.source.CaptureErrorEvent;
import com.phillippitts.talkback.service.capture.SegmentCaptureEngine;
import com.phillippitts.talkback.service.orchestration.event.UtteranceRecognizedEvent;
import com.phillippitts.talkback.service.session.ConversationSessionManager;
import com.phillippitts.talkback.service.state.InteractionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one listen call and routes its result through the session manager.
 *
 * <p>Accepted utterances are published as {@link UtteranceRecognizedEvent}. Microphone failures
 * are published as {@link CaptureErrorEvent} and rethrown to the caller.
 */
@Service
public class VoiceInteractionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(VoiceInteractionOrchestrator.class);

    private final SegmentCaptureEngine engine;
    private final ConversationSessionManager sessions;
    private final InteractionState state;
    private final ApplicationEventPublisher publisher;

    public VoiceInteractionOrchestrator(SegmentCaptureEngine engine,
                                        ConversationSessionManager sessions,
                                        InteractionState state,
                                        ApplicationEventPublisher publisher) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.state = Objects.requireNonNull(state, "state");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Listens once and hands the utterance to the session manager.
     *
     * @return identity of the active session after the utterance, or empty when nothing was heard
     *         or no session is active
     * @throws AudioSourceUnavailableException if the microphone failed
     */
    public Optional<String> listenOnce(Duration timeout, Duration silenceThreshold,
                                       Duration maxTotalTime, ListenMode mode) {
        String heard;
        try {
            heard = engine.listen(timeout, silenceThreshold, maxTotalTime, mode);
        } catch (AudioSourceUnavailableException e) {
            publisher.publishEvent(new CaptureErrorEvent("MIC_UNAVAILABLE", state.clock().instant()));
            throw e;
        }
        if (heard == null) {
            return Optional.empty();
        }

        String identity = sessions.onUtterance(heard);
        if (identity == null) {
            LOG.debug("Utterance outside an active session ignored");
            return Optional.empty();
        }
        publisher.publishEvent(new UtteranceRecognizedEvent(heard, identity, mode, state.clock().instant()));
        return Optional.of(identity);
    }
}
