package com.phillippitts.talkback.service.audio.source;

import com.phillippitts.talkback.exception.AudioSourceUnavailableException;

/**
 * Provider of live microphone audio.
 *
 * <p>Each listen call opens one stream and closes it when the call returns. Implementations
 * must allow a new stream to be opened after the previous one was closed.
 */
public interface AudioFrameSource {

    /**
     * Opens the capture device.
     *
     * @return an open stream; the caller must close it
     * @throws AudioSourceUnavailableException if the device cannot be opened
     */
    AudioFrameStream open();
}
