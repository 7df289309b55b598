package com.phillippitts.talkback.service.audio.source;

import com.phillippitts.talkback.domain.AudioSegment;
import com.phillippitts.talkback.exception.AudioSourceUnavailableException;

import java.time.Duration;

/**
 * An open capture stream. Not thread-safe; owned by one capture task.
 */
public interface AudioFrameStream extends AutoCloseable {

    /**
     * Blocks until {@code duration} of audio has been captured.
     *
     * @param duration how much audio to read
     * @return the captured segment
     * @throws AudioSourceUnavailableException if the device stops delivering audio
     */
    AudioSegment read(Duration duration);

    @Override
    void close();
}
