package com.phillippitts.talkback.exception;

/**
 * Thrown at startup when the self-speech catalog resource is missing or unreadable.
 */
public class SelfSpeechCatalogException extends TalkBackException {

    private final String location;

    public SelfSpeechCatalogException(String location, Throwable cause) {
        super("Self-speech catalog could not be loaded from: " + location, cause);
        this.location = location;
    }

    public SelfSpeechCatalogException(String location) {
        super("Self-speech catalog not found at: " + location);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
