package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.config.properties.SessionProperties;
import com.phillippitts.talkback.domain.ConversationSession;
import com.phillippitts.talkback.service.metrics.VoiceMetrics;
import com.phillippitts.talkback.service.session.event.SessionEndedEvent;
import com.phillippitts.talkback.service.session.event.SessionStartedEvent;
import com.phillippitts.talkback.service.state.InteractionState;
import com.phillippitts.talkback.service.stt.TokenizerUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Wake-word session state machine.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE + trigger phrase for X        → ACTIVE(X), returns X
 * ACTIVE(X) + any text, not expired  → ACTIVE(X), timestamp refreshed, returns X
 * ACTIVE(X) + end phrase             → IDLE, returns null
 * ACTIVE(X) expired                  → IDLE before the text is handled
 * </pre>
 *
 * <p>With {@link SessionProperties.CollisionPolicy#SWITCH}, another identity's trigger phrase
 * during an active session hands the session over; with {@code IGNORE} it is ordinary text.
 *
 * <p><b>Thread Safety:</b> the session lives in {@link InteractionState} and is only read or
 * written under its lock. Events are published after the lock is released.
 */
@Component
public class ConversationSessionManager {

    private static final Logger LOG = LogManager.getLogger(ConversationSessionManager.class);

    private final InteractionState state;
    private final TriggerPhraseTable triggers;
    private final SessionProperties props;
    private final ApplicationEventPublisher publisher;
    private final VoiceMetrics metrics;

    public ConversationSessionManager(InteractionState state, TriggerPhraseTable triggers, SessionProperties props,
                                      ApplicationEventPublisher publisher, VoiceMetrics metrics) {
        this.state = Objects.requireNonNull(state, "state");
        this.triggers = Objects.requireNonNull(triggers, "triggers");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Feeds one assembled utterance into the session state machine.
     *
     * @param text utterance; null or blank returns null and leaves the session untouched
     * @return the identity of the active session after handling {@code text}, or null when idle
     */
    public String onUtterance(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Instant now = state.clock().instant();
        List<Object> events = new ArrayList<>(2);

        String identity = state.callLocked(() -> {
            ConversationSession active = state.session();
            if (active != null && active.isExpired(now)) {
                state.session(null);
                events.add(new SessionEndedEvent(active.identity(), SessionEndedEvent.Reason.TIMEOUT, now));
                active = null;
            }

            if (active == null) {
                Optional<String> triggered = triggers.match(text);
                if (triggered.isEmpty()) {
                    return null;
                }
                state.session(new ConversationSession(triggered.get(), now, props.getTimeout()));
                events.add(new SessionStartedEvent(triggered.get(), now));
                return triggered.get();
            }

            if (isEndPhrase(text)) {
                state.session(null);
                events.add(new SessionEndedEvent(active.identity(), SessionEndedEvent.Reason.END_PHRASE, now));
                return null;
            }

            if (props.getCollisionPolicy() == SessionProperties.CollisionPolicy.SWITCH) {
                Optional<String> other = triggers.match(text);
                if (other.isPresent() && !other.get().equals(active.identity())) {
                    state.session(new ConversationSession(other.get(), now, props.getTimeout()));
                    events.add(new SessionEndedEvent(active.identity(), SessionEndedEvent.Reason.SWITCHED, now));
                    events.add(new SessionStartedEvent(other.get(), now));
                    return other.get();
                }
            }

            state.session(active.refreshedAt(now));
            return active.identity();
        });

        events.forEach(this::publish);
        return identity;
    }

    /**
     * Returns the active session, if one exists and has not expired.
     *
     * @return active session
     */
    public Optional<ConversationSession> currentSession() {
        Instant now = state.clock().instant();
        return state.callLocked(() -> Optional.ofNullable(state.session()).filter(s -> !s.isExpired(now)));
    }

    /**
     * Ends the active session, if any.
     *
     * @return true if a session was ended
     */
    public boolean endSession() {
        Instant now = state.clock().instant();
        ConversationSession ended = state.callLocked(() -> {
            ConversationSession active = state.session();
            state.session(null);
            return active;
        });
        if (ended == null) {
            return false;
        }
        publish(new SessionEndedEvent(ended.identity(), SessionEndedEvent.Reason.MANUAL, now));
        return true;
    }

    boolean isEndPhrase(String text) {
        for (String phrase : props.getEndPhrases()) {
            if (TokenizerUtil.containsPhrase(text, phrase)) {
                return true;
            }
        }
        return false;
    }

    private void publish(Object event) {
        if (event instanceof SessionStartedEvent started) {
            LOG.info("Session started for '{}'", started.identity());
            metrics.incrementSessionTransition("started");
        } else if (event instanceof SessionEndedEvent ended) {
            LOG.info("Session for '{}' ended: {}", ended.identity(), ended.reason());
            metrics.incrementSessionTransition("ended-" + ended.reason().name().toLowerCase(Locale.ROOT));
        }
        publisher.publishEvent(event);
    }
}
