package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The single active conversation: who is talking and when they last spoke.
 *
 * @param identity        identity whose trigger phrase opened the session
 * @param lastInteraction instant of the most recent recognized utterance
 * @param timeout         inactivity after which the session expires
 */
public record ConversationSession(String identity, Instant lastInteraction, Duration timeout) {

    public ConversationSession {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(lastInteraction, "lastInteraction must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Returns true once more than {@code timeout} has passed since the last interaction.
     *
     * @param now current instant
     * @return whether the session has expired
     */
    public boolean isExpired(Instant now) {
        return Duration.between(lastInteraction, now).compareTo(timeout) > 0;
    }

    public ConversationSession refreshedAt(Instant now) {
        return new ConversationSession(identity, now, timeout);
    }
}
