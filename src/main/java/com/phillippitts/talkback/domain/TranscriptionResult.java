package com.phillippitts.talkback.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of one speech-to-text call.
 *
 * @param text         the transcribed text, empty when no speech was recognized (never null)
 * @param languageHint BCP-47 language hint the audio was submitted with
 * @param timestamp    when the transcription completed
 * @param engineName   name of the recognizer that produced this result
 */
public record TranscriptionResult(
        String text,
        String languageHint,
        Instant timestamp,
        String engineName
) {

    /**
     * Compact constructor with validation.
     *
     * <p>Note: Empty text is valid and means "no speech detected", which is a normal outcome.
     *
     * @throws NullPointerException if any component is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(languageHint, "Language hint must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    /**
     * Creates a TranscriptionResult with the current timestamp.
     *
     * @param text         transcribed text
     * @param languageHint language hint used
     * @param engineName   recognizer name
     * @return a new TranscriptionResult instance
     */
    public static TranscriptionResult of(String text, String languageHint, String engineName) {
        return new TranscriptionResult(text, languageHint, Instant.now(), engineName);
    }

    /** True when the recognizer heard no speech. */
    public boolean isEmpty() {
        return text.isBlank();
    }
}
