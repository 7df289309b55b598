package com.phillippitts.talkback.service.state;

import java.time.Instant;

/**
 * Published after the assistant starts or stops producing audio.
 *
 * @param speaking new speaking state
 * @param at       when the change happened
 */
public record SpeakingStateChangedEvent(boolean speaking, Instant at) { }
