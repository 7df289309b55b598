package com.phillippitts.talkback.domain;

import java.time.Duration;

/**
 * Capture mode supplied by the caller of each listen call.
 *
 * <p>The mode indexes the per-mode multiplier table of the active {@link EnvironmentProfile}
 * and selects the base chunk duration. Shorter chunks trade transcription context for
 * reaction time.
 */
public enum ListenMode {

    /** Regular conversation. */
    NORMAL(600),

    /** Word and spelling games: short answers, quieter speakers. */
    WORD_GAME(300),

    /** Second-language games: transcribed with the regional language hint first. */
    INTL_GAME(400),

    /** Cancellation-phrase detection while the assistant is speaking. */
    INTERRUPT_CHECK(200);

    private final int defaultChunkMillis;

    ListenMode(int defaultChunkMillis) {
        this.defaultChunkMillis = defaultChunkMillis;
    }

    /**
     * Returns the chunk duration used when no override is configured.
     *
     * @return base chunk duration before the profile's chunk multiplier is applied
     */
    public Duration defaultChunkDuration() {
        return Duration.ofMillis(defaultChunkMillis);
    }
}
