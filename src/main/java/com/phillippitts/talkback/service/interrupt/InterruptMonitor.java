package com.phillippitts.talkback.service.interrupt;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.config.properties.InterruptProperties;
import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.domain.EnvironmentProfile;
import com.phillippitts.talkback.domain.ListenMode;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.audio.source.AudioFrameSource;
import com.phillippitts.talkback.service.audio.source.AudioFrameStream;
import com.phillippitts.talkback.service.audio.source.CaptureErrorEvent;
import com.phillippitts.talkback.service.capture.ChunkClassifier;
import com.phillippitts.talkback.service.capture.ChunkOutcome;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.playback.PlaybackController;
import com.phillippitts.talkback.service.profile.EnvironmentProfileResolver;
import com.phillippitts.talkback.service.state.InteractionState;
import com.phillippitts.talkback.service.state.SpeakingStateChangedEvent;
import com.phillippitts.talkback.service.stt.TokenizerUtil;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Listens for cancellation phrases while the assistant is speaking and stops playback when one
 * is heard.
 *
 * <p>Starts on {@link SpeakingStateChangedEvent} with {@code speaking=true} and runs on the
 * {@code interruptExecutor} until speaking stops. Chunks use {@link ListenMode#INTERRUPT_CHECK}
 * thresholds and go through the same self-speech filter as regular capture, so the assistant
 * saying "stop" in its own reply does not cancel itself.
 */
@Component
public class InterruptMonitor {

    private static final Logger LOG = LogManager.getLogger(InterruptMonitor.class);

    private final AudioFrameSource source;
    private final ChunkClassifier classifier;
    private final EnvironmentProfileResolver profiles;
    private final InteractionState state;
    private final PlaybackController playback;
    private final InterruptProperties props;
    private final String languageHint;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final VoiceMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public InterruptMonitor(AudioFrameSource source,
                            ChunkClassifier classifier,
                            EnvironmentProfileResolver profiles,
                            InteractionState state,
                            PlaybackController playback,
                            InterruptProperties props,
                            AssemblerProperties assemblerProperties,
                            @Qualifier("interruptExecutor") Executor executor,
                            ApplicationEventPublisher publisher,
                            VoiceMetrics metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.state = Objects.requireNonNull(state, "state");
        this.playback = Objects.requireNonNull(playback, "playback");
        this.props = Objects.requireNonNull(props, "props");
        this.languageHint = assemblerProperties.defaultHints().get(0);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @EventListener
    public void onSpeakingStateChanged(SpeakingStateChangedEvent event) {
        if (!event.speaking() || !props.isEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::monitor);
        } catch (RejectedExecutionException e) {
            running.set(false);
            LOG.warn("Interrupt monitor could not be scheduled: {}", e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    void monitor() {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext
                .put("mode", ListenMode.INTERRUPT_CHECK.name())) {
            EnvironmentProfile profile = profiles.probe();
            int gate = profile.effectiveThreshold(ListenMode.INTERRUPT_CHECK);
            Duration chunk = profile.scaleChunk(props.getCheckDuration());
            LOG.debug("Interrupt monitor started (chunk={}ms, gate={})", chunk.toMillis(), gate);

            try (AudioFrameStream stream = source.open()) {
                while (state.isSpeaking() && !Thread.currentThread().isInterrupted()) {
                    AudioSegment segment = stream.read(chunk);
                    if (!state.isSpeaking()) {
                        break;
                    }
                    Optional<String> phrase = cancellationIn(classifier.classify(
                            segment, gate, languageHint, ListenMode.INTERRUPT_CHECK));
                    if (phrase.isPresent()) {
                        interrupt(phrase.get());
                        break;
                    }
                }
            }
        } catch (AudioSourceUnavailableException e) {
            LOG.warn("Interrupt monitor stopped: {}", e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("INTERRUPT_MIC_UNAVAILABLE", state.clock().instant()));
        } finally {
            running.set(false);
            LOG.debug("Interrupt monitor stopped");
        }
    }

    Optional<String> cancellationIn(ChunkOutcome outcome) {
        if (!outcome.isHuman()) {
            return Optional.empty();
        }
        for (String phrase : props.getPhrases()) {
            if (TokenizerUtil.containsPhrase(outcome.text(), phrase)) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }

    private void interrupt(String phrase) {
        LOG.info("Cancellation phrase '{}' heard; stopping playback", phrase);
        playback.stopImmediately();
        state.finishSpeaking();
        metrics.incrementInterrupt();
        publisher.publishEvent(new PlaybackInterruptedEvent(phrase, state.clock().instant()));
    }
}
