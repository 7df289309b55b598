package com.phillippitts.talkback.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and audio line management.
 *
 * @see com.phillippitts.talkback.service.stt.whisper.WhisperProcessRunner
 * @see com.phillippitts.talkback.service.audio.source.JavaSoundAudioFrameSource
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
