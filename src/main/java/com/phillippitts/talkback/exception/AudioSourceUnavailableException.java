package com.phillippitts.talkback.exception;

/**
 * Thrown when the audio frame source cannot be opened or stops delivering audio.
 * This is the only failure that escapes a listen call.
 */
public class AudioSourceUnavailableException extends TalkBackException {

    private final String device;

    public AudioSourceUnavailableException(String message, String device) {
        super(message + " (device: " + device + ")");
        this.device = device;
    }

    public AudioSourceUnavailableException(String message, String device, Throwable cause) {
        super(message + " (device: " + device + ")", cause);
        this.device = device;
    }

    public String getDevice() {
        return device;
    }
}
