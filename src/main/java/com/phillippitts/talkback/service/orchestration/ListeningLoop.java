package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;
import com.phillippitts.talkback.service.state.InteractionState;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Optional continuous listening loop driven by {@code listen.loop.*}.
 *
 * <p>While the assistant is speaking the loop idles; after a microphone failure it waits
 * {@code listen.loop.error-backoff} before trying again.
 */
@Service
public class ListeningLoop implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ListeningLoop.class);

    static final Duration SPEAKING_POLL = Duration.ofMillis(100);

    private final VoiceInteractionOrchestrator orchestrator;
    private final InteractionState state;
    private final ListenProperties.Loop loop;
    private final Executor executor;

    private volatile boolean running;

    public ListeningLoop(VoiceInteractionOrchestrator orchestrator,
                         InteractionState state,
                         ListenProperties props,
                         @Qualifier("captureExecutor") Executor executor) {
        this.orchestrator = orchestrator;
        this.state = state;
        this.loop = props.getLoop();
        this.executor = executor;
    }

    @Override
    public void start() {
        if (running || !loop.isEnabled()) {
            return;
        }
        running = true;
        try {
            executor.execute(this::run);
            LOG.info("Listening loop started (mode={})", loop.getMode());
        } catch (RejectedExecutionException e) {
            running = false;
            LOG.error("Listening loop could not be scheduled", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOG.info("Listening loop stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void run() {
        while (running && !Thread.currentThread().isInterrupted()) {
            if (!iterate()) {
                break;
            }
        }
    }

    /**
     * One pass of the loop.
     *
     * @return false if the thread was interrupted while waiting
     */
    boolean iterate() {
        if (state.isSpeaking()) {
            return TimeUtils.sleepQuietly(SPEAKING_POLL);
        }
        try {
            orchestrator.listenOnce(loop.getTimeout(), loop.getSilenceThreshold(),
                    loop.getMaxTotalTime(), loop.getMode());
            return true;
        } catch (AudioSourceUnavailableException e) {
            LOG.warn("Microphone unavailable; retrying in {}ms: {}", loop.getErrorBackoff().toMillis(), e.getMessage());
            return TimeUtils.sleepQuietly(loop.getErrorBackoff());
        }
    }
}
