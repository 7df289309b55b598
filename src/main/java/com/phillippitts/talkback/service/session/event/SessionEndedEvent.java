package com.phillippitts.talkback.service.session.event;

import java.time.Instant;

/**
 * Published when the active conversation session ends.
 *
 * @param identity identity whose session ended
 * @param reason   why it ended
 * @param at       when it ended
 */
public record SessionEndedEvent(String identity, Reason reason, Instant at) {

    public enum Reason {
        /** The user said an end phrase. */
        END_PHRASE,
        /** No utterance arrived within the session timeout. */
        TIMEOUT,
        /** Another identity's trigger phrase took over the session. */
        SWITCHED,
        /** Ended programmatically. */
        MANUAL
    }
}
