package com.phillippitts.talkback.service.state;

import java.time.Instant;

/**
 * Consistent view of the playback side of {@link InteractionState}.
 *
 * @param speaking     whether the assistant is producing audio
 * @param text         literal text most recently sent to playback, or null
 * @param endedAt      when playback of {@code text} ended, null while speaking or before any playback
 */
public record PlaybackSnapshot(boolean speaking, String text, Instant endedAt) { }
