package com.phillippitts.talkback.exception;

/**
 * Thrown when a speech recognizer call fails: process crash, timeout, or unusable output.
 *
 * <p>Callers inside the capture pipeline absorb this exception and treat the chunk or attempt
 * as if no speech had been recognized.
 */
public class TranscriptionServiceUnavailableException extends TalkBackException {

    private final String recognizerName;

    public TranscriptionServiceUnavailableException(String message) {
        super(message);
        this.recognizerName = "unknown";
    }

    public TranscriptionServiceUnavailableException(String message, String recognizerName) {
        super(message + " (recognizer: " + recognizerName + ")");
        this.recognizerName = recognizerName;
    }

    public TranscriptionServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.recognizerName = "unknown";
    }

    public TranscriptionServiceUnavailableException(String message, String recognizerName, Throwable cause) {
        super(message + " (recognizer: " + recognizerName + ")", cause);
        this.recognizerName = recognizerName;
    }

    public String getRecognizerName() {
        return recognizerName;
    }
}
