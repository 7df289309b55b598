package com.phillippitts.talkback.service.orchestration.event;

import com.phillippitts.talkback.domain.ListenMode;

import java.time.Instant;

/**
 * Emitted when a listen call produced an utterance that the session manager accepted.
 *
 * @param text     the finalized transcript
 * @param identity identity of the active session
 * @param mode     capture mode the utterance was heard in
 * @param at       when the utterance was accepted
 */
public record UtteranceRecognizedEvent(
        String text,
        String identity,
        ListenMode mode,
        Instant at
) {}
