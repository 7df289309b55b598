package com.phillippitts.talkback.service.interrupt;

import java.time.Instant;

/**
 * Published after a cancellation phrase stopped playback.
 *
 * @param phrase the cancellation phrase that was heard
 * @param at     when playback was stopped
 */
public record PlaybackInterruptedEvent(String phrase, Instant at) { }
