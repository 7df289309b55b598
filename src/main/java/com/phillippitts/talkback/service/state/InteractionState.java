package com.phillippitts.talkback.service.state;

import com.phillippitts.talkback.domain.ConversationSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shared interaction state: whether the assistant is speaking, what it said last, and the
 * active conversation session.
 *
 * <p>All fields are guarded by one {@link ReentrantLock}. No caller may hold the lock across
 * audio capture or a recognizer call. {@link SpeakingStateChangedEvent}s are published after
 * the lock is released.
 *
 * <p><b>Playback contract:</b> the playback collaborator calls {@link #beginSpeaking(String)}
 * before emitting audio and {@link #finishSpeaking()} once it has stopped.
 *
 * @since 1.0
 */
@Component
public final class InteractionState {

    private static final Logger LOG = LogManager.getLogger(InteractionState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private boolean speaking;
    private String playbackText;
    private Instant playbackEndedAt;
    private ConversationSession session;

    public InteractionState(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isSpeaking() {
        lock.lock();
        try {
            return speaking;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the assistant as speaking {@code text}.
     *
     * @param text literal text sent to playback (may be null when unknown)
     */
    public void beginSpeaking(String text) {
        boolean changed;
        lock.lock();
        try {
            changed = !speaking;
            speaking = true;
            playbackText = text;
            playbackEndedAt = null;
        } finally {
            lock.unlock();
        }
        if (changed) {
            publish(true);
        }
    }

    /** Marks playback as stopped, whether it finished or was interrupted. */
    public void finishSpeaking() {
        setSpeaking(false);
    }

    /**
     * Sets the speaking flag without changing the remembered playback text.
     *
     * @param value new speaking state
     */
    public void setSpeaking(boolean value) {
        boolean changed;
        lock.lock();
        try {
            changed = speaking != value;
            speaking = value;
            if (changed && !value) {
                playbackEndedAt = clock.instant();
            }
        } finally {
            lock.unlock();
        }
        if (changed) {
            publish(value);
        }
    }

    public PlaybackSnapshot playbackSnapshot() {
        lock.lock();
        try {
            return new PlaybackSnapshot(speaking, playbackText, playbackEndedAt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the state lock.
     *
     * <p>Use for read-modify-write of the session. The action must not block on I/O.
     *
     * @param action work to run
     * @param <T>    result type
     * @return the action's result
     */
    public <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the active session; the caller must hold the lock via {@link #callLocked}.
     *
     * @return active session or null
     * @throws IllegalStateException if the lock is not held
     */
    public ConversationSession session() {
        requireLock();
        return session;
    }

    /**
     * Replaces the active session; the caller must hold the lock via {@link #callLocked}.
     *
     * @param newSession session to store, null for none
     * @throws IllegalStateException if the lock is not held
     */
    public void session(ConversationSession newSession) {
        requireLock();
        this.session = newSession;
    }

    public Clock clock() {
        return clock;
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session access requires the interaction state lock");
        }
    }

    private void publish(boolean value) {
        LOG.debug("Speaking state changed: speaking={}", value);
        publisher.publishEvent(new SpeakingStateChangedEvent(value, clock.instant()));
    }
}
