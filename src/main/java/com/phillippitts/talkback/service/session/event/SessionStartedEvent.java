package com.phillippitts.talkback.service.session.event;

import java.time.Instant;

/**
 * Published when a trigger phrase opens a conversation session.
 *
 * @param identity identity the session belongs to
 * @param at       when the session started
 */
public record SessionStartedEvent(String identity, Instant at) { }
